package com.weiwo.bridge.utils;

/**
 * 错误分类，决定记录的状态走向
 */
public enum ErrorType {

    /** 根目录缺失或不可读，中止本次发现任务 */
    FILESYSTEM("文件系统错误"),
    /** 单个文件不可读或上传被拒，记录置为 failed */
    CONTENT("文件内容错误"),
    /** 超时、连接失败、5xx，不改变状态，下个周期重试 */
    REMOTE_TRANSIENT("外部接口暂时不可用"),
    /** 外部系统明确拒绝或不存在该条目 */
    REMOTE_DEFINITIVE("外部接口确定性失败"),
    /** 台账数据不满足约束 */
    INVARIANT("数据约束违反"),
    /** 台账读写失败，中止本次任务 */
    DATABASE("数据库错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
