package com.weiwo.bridge.dto;

/**
 * 发现任务写入台账的结果
 */
public enum UpsertOutcome {
    /** 新路径，插入 discover 记录 */
    INSERTED,
    /** 元数据变化，重置为 discover */
    UPDATED,
    /** 元数据未变化 */
    UNCHANGED,
    /** 记录处于 processing，或守卫条件未命中，留待下次 */
    DEFERRED,
    /** 记录已是 deleted，不再处理 */
    IGNORED
}
