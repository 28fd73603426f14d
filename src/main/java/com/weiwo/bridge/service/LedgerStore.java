package com.weiwo.bridge.service;

import com.weiwo.bridge.dto.UpsertOutcome;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.NavigableMap;

/**
 * 文件同步台账
 *
 * <p>发现、提交、轮询三个任务之间唯一的共享状态。每个写操作都是单行、单语句的条件更新，
 * 守卫条件（当前状态、期望的 knowledge_id）写在 WHERE 子句中由数据库原子判断，
 * 因此多个进程并发运行同一任务时无需加锁。</p>
 *
 * <p>带 {@code expectedKnowledgeId} 的方法只在记录仍持有该外部 ID 时生效，
 * 传入 null 表示期望记录当前没有外部 ID。</p>
 */
public interface LedgerStore {

    /**
     * 新路径插入 discover 记录；已有记录且大小或修改时间变化时重置为 discover。
     * processing 记录不改动（DEFERRED），deleted 记录忽略（IGNORED）。
     */
    Mono<UpsertOutcome> upsertDiscovered(String filepath, long size, double mtime);

    /**
     * 同上，但重置仅在记录仍持有 expectedKnowledgeId 时生效（远端删除之后调用）
     */
    Mono<UpsertOutcome> upsertDiscovered(String filepath, long size, double mtime, String expectedKnowledgeId);

    /**
     * 标记为 deleted 并清空 knowledge_id，已删除的记录不受影响
     *
     * @return 是否实际更新
     */
    Mono<Boolean> markDeleted(String filepath);

    Mono<Boolean> markDeleted(String filepath, String expectedKnowledgeId);

    /**
     * 按状态列出记录（插入顺序）
     */
    Flux<DocumentRecord> listByStatus(FileStatus status, int limit);

    /**
     * pending/processing 记录的键集分页，id 大于 afterId
     */
    Flux<DocumentRecord> listActive(long afterId, int limit);

    /**
     * 所有未删除记录，按路径排序
     */
    Mono<NavigableMap<String, DocumentRecord>> snapshotActive();

    Mono<DocumentRecord> findById(long id);

    /**
     * 提交成功后推进状态，仅对 discover 记录生效
     *
     * @return 是否实际更新；false 表示记录已被其他任务推进
     */
    Mono<Boolean> transitionOnSubmit(long id, FileStatus newStatus, String knowledgeId, String fileHash, String storePath);

    /**
     * 提交失败，仅对 discover 记录生效，knowledge_id 保持不变
     */
    Mono<Boolean> markFailed(long id, String reason);

    /**
     * pending 与 processing 之间的非终态变更
     */
    Mono<Boolean> updateStatus(long id, String expectedKnowledgeId, FileStatus status);

    /**
     * 进入终态 completed/failed，仅对 pending/processing 记录生效
     */
    Mono<Boolean> finalize(long id, FileStatus status, String reason);

    Mono<Boolean> finalize(long id, String expectedKnowledgeId, FileStatus status, String reason);

    /**
     * 人工重试：failed 记录重置为 discover 并清空外部状态
     */
    Mono<Boolean> resetFailed(long id, String expectedKnowledgeId);

    /**
     * 路径以指定文件名结尾的记录（合同关联使用）
     */
    Flux<DocumentRecord> findByFilenameSuffix(String physicalFilename);

    /**
     * 写入合同显示名称与合同信息
     */
    Mono<Boolean> linkContract(long id, String displayName, String contractTitle, int contractOrd, String databaseName);

    /**
     * 追加一条任务执行记录
     */
    Mono<ScriptProcessRecord> recordRun(ScriptProcessRecord record);
}
