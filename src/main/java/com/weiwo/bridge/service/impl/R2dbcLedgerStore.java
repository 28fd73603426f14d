package com.weiwo.bridge.service.impl;

import com.weiwo.bridge.dto.UpsertOutcome;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.repository.DocumentRecordRepository;
import com.weiwo.bridge.repository.ScriptProcessRecordRepository;
import com.weiwo.bridge.service.LedgerStore;
import com.weiwo.bridge.utils.DateUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 基于 R2DBC 的台账实现
 * 读取走 Repository，所有状态变更走 DatabaseClient 条件更新
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcLedgerStore implements LedgerStore {

    private static final String TABLE = "document_status_table";

    private static final String RESET_TO_DISCOVER_SET =
            "file_status = 'discover', knowledge_id = NULL, file_hash = NULL, file_store_path = NULL, "
            + "failed_msg = NULL, process_at = NULL, finish_at = NULL";

    private final DocumentRecordRepository documentRecordRepository;
    private final ScriptProcessRecordRepository scriptProcessRecordRepository;
    private final DatabaseClient databaseClient;

    @Override
    public Mono<UpsertOutcome> upsertDiscovered(String filepath, long size, double mtime) {
        return upsert(filepath, size, mtime, false, null);
    }

    @Override
    public Mono<UpsertOutcome> upsertDiscovered(String filepath, long size, double mtime, String expectedKnowledgeId) {
        return upsert(filepath, size, mtime, true, expectedKnowledgeId);
    }

    private Mono<UpsertOutcome> upsert(String filepath, long size, double mtime,
                                       boolean guardKnowledgeId, String expectedKnowledgeId) {
        return documentRecordRepository.findByFilepath(filepath)
                .flatMap(existing -> resetIfChanged(existing, size, mtime, guardKnowledgeId, expectedKnowledgeId))
                .switchIfEmpty(Mono.defer(() -> insertDiscovered(filepath, size, mtime)));
    }

    private Mono<UpsertOutcome> resetIfChanged(DocumentRecord existing, long size, double mtime,
                                               boolean guardKnowledgeId, String expectedKnowledgeId) {
        if (existing.getFileStatus() == FileStatus.DELETED) {
            return Mono.just(UpsertOutcome.IGNORED);
        }
        boolean unchanged = existing.getFileSize() != null && existing.getFileSize() == size
                && DateUtils.sameModifiedTime(existing.getLastModifiedTime(), mtime);
        if (unchanged) {
            return Mono.just(UpsertOutcome.UNCHANGED);
        }
        if (existing.getFileStatus() == FileStatus.PROCESSING) {
            return Mono.just(UpsertOutcome.DEFERRED);
        }

        StringBuilder sql = new StringBuilder("UPDATE ").append(TABLE).append(" SET ")
                .append(RESET_TO_DISCOVER_SET)
                .append(", created_at = :now, last_modified_time = :mtime, file_size = :size")
                .append(" WHERE filepath = :filepath AND file_status NOT IN ('processing', 'deleted')");
        if (guardKnowledgeId) {
            appendKnowledgeIdGuard(sql, expectedKnowledgeId);
        }

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
                .bind("now", LocalDateTime.now())
                .bind("mtime", mtime)
                .bind("size", size)
                .bind("filepath", existing.getFilepath());
        if (guardKnowledgeId && expectedKnowledgeId != null) {
            spec = spec.bind("kid", expectedKnowledgeId);
        }
        return spec.fetch().rowsUpdated()
                .map(rows -> {
                    if (rows > 0) {
                        return UpsertOutcome.UPDATED;
                    }
                    log.info("台账记录已被其他任务修改，本次不重置: filepath={}", existing.getFilepath());
                    return UpsertOutcome.DEFERRED;
                });
    }

    private Mono<UpsertOutcome> insertDiscovered(String filepath, long size, double mtime) {
        DocumentRecord record = new DocumentRecord();
        record.setFilepath(filepath);
        Path fileName = Path.of(filepath).getFileName();
        record.setFilename(fileName != null ? fileName.toString() : filepath);
        record.setFileStatus(FileStatus.DISCOVER);
        record.setCreatedAt(LocalDateTime.now());
        record.setLastModifiedTime(mtime);
        record.setFileSize(size);
        return documentRecordRepository.save(record)
                .thenReturn(UpsertOutcome.INSERTED)
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    // 并发发现任务已插入同一路径
                    log.info("路径已由其他任务插入: filepath={}", filepath);
                    return Mono.just(UpsertOutcome.UNCHANGED);
                });
    }

    @Override
    public Mono<Boolean> markDeleted(String filepath) {
        return markDeleted(filepath, false, null);
    }

    @Override
    public Mono<Boolean> markDeleted(String filepath, String expectedKnowledgeId) {
        return markDeleted(filepath, true, expectedKnowledgeId);
    }

    private Mono<Boolean> markDeleted(String filepath, boolean guardKnowledgeId, String expectedKnowledgeId) {
        StringBuilder sql = new StringBuilder("UPDATE ").append(TABLE)
                .append(" SET file_status = 'deleted', finish_at = :now, knowledge_id = NULL")
                .append(" WHERE filepath = :filepath AND file_status <> 'deleted'");
        if (guardKnowledgeId) {
            appendKnowledgeIdGuard(sql, expectedKnowledgeId);
        }
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
                .bind("now", LocalDateTime.now())
                .bind("filepath", filepath);
        if (guardKnowledgeId && expectedKnowledgeId != null) {
            spec = spec.bind("kid", expectedKnowledgeId);
        }
        return applied(spec);
    }

    @Override
    public Flux<DocumentRecord> listByStatus(FileStatus status, int limit) {
        return documentRecordRepository.findByStatusOrderById(status.getValue(), limit);
    }

    @Override
    public Flux<DocumentRecord> listActive(long afterId, int limit) {
        return documentRecordRepository.findActiveAfter(afterId, limit);
    }

    @Override
    public Mono<NavigableMap<String, DocumentRecord>> snapshotActive() {
        return documentRecordRepository.findAllNotDeleted()
                .<NavigableMap<String, DocumentRecord>>collect(TreeMap::new,
                        (map, record) -> map.put(record.getFilepath(), record));
    }

    @Override
    public Mono<DocumentRecord> findById(long id) {
        return documentRecordRepository.findById(id);
    }

    @Override
    public Mono<Boolean> transitionOnSubmit(long id, FileStatus newStatus, String knowledgeId,
                                            String fileHash, String storePath) {
        if (!newStatus.isActive()) {
            return Mono.error(new IllegalArgumentException("提交后的状态只能是 pending 或 processing: " + newStatus));
        }
        if (knowledgeId == null || knowledgeId.isBlank()) {
            return Mono.error(new IllegalArgumentException("提交成功但缺少 knowledge_id: id=" + id));
        }
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "UPDATE " + TABLE + " SET file_status = :status, knowledge_id = :kid, file_hash = :hash, "
                        + "file_store_path = :storePath, process_at = :now, failed_msg = NULL "
                        + "WHERE id = :id AND file_status = 'discover'")
                .bind("status", newStatus.getValue())
                .bind("kid", knowledgeId)
                .bind("now", LocalDateTime.now())
                .bind("id", id);
        spec = bindNullable(spec, "hash", fileHash);
        spec = bindNullable(spec, "storePath", storePath);
        return applied(spec);
    }

    @Override
    public Mono<Boolean> markFailed(long id, String reason) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "UPDATE " + TABLE + " SET file_status = 'failed', failed_msg = :reason, process_at = :now "
                        + "WHERE id = :id AND file_status = 'discover'")
                .bind("now", LocalDateTime.now())
                .bind("id", id);
        return applied(bindNullable(spec, "reason", truncate(reason)));
    }

    @Override
    public Mono<Boolean> updateStatus(long id, String expectedKnowledgeId, FileStatus status) {
        if (!status.isActive()) {
            return Mono.error(new IllegalArgumentException("非终态变更只允许 pending/processing: " + status));
        }
        StringBuilder sql = new StringBuilder("UPDATE ").append(TABLE)
                .append(" SET file_status = :status WHERE id = :id AND file_status IN ('pending', 'processing')");
        appendKnowledgeIdGuard(sql, expectedKnowledgeId);
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
                .bind("status", status.getValue())
                .bind("id", id);
        if (expectedKnowledgeId != null) {
            spec = spec.bind("kid", expectedKnowledgeId);
        }
        return applied(spec);
    }

    @Override
    public Mono<Boolean> finalize(long id, FileStatus status, String reason) {
        return finalize(id, false, null, status, reason);
    }

    @Override
    public Mono<Boolean> finalize(long id, String expectedKnowledgeId, FileStatus status, String reason) {
        return finalize(id, true, expectedKnowledgeId, status, reason);
    }

    private Mono<Boolean> finalize(long id, boolean guardKnowledgeId, String expectedKnowledgeId,
                                   FileStatus status, String reason) {
        if (status != FileStatus.COMPLETED && status != FileStatus.FAILED) {
            return Mono.error(new IllegalArgumentException("终态只能是 completed 或 failed: " + status));
        }
        StringBuilder sql = new StringBuilder("UPDATE ").append(TABLE)
                .append(" SET file_status = :status, finish_at = :now, failed_msg = :reason")
                .append(" WHERE id = :id AND file_status IN ('pending', 'processing')");
        if (guardKnowledgeId) {
            appendKnowledgeIdGuard(sql, expectedKnowledgeId);
        }
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
                .bind("status", status.getValue())
                .bind("now", LocalDateTime.now())
                .bind("id", id);
        // 成功时清空历史错误信息
        spec = bindNullable(spec, "reason", status == FileStatus.FAILED ? truncate(reason) : null);
        if (guardKnowledgeId && expectedKnowledgeId != null) {
            spec = spec.bind("kid", expectedKnowledgeId);
        }
        return applied(spec);
    }

    @Override
    public Mono<Boolean> resetFailed(long id, String expectedKnowledgeId) {
        StringBuilder sql = new StringBuilder("UPDATE ").append(TABLE).append(" SET ")
                .append(RESET_TO_DISCOVER_SET)
                .append(", created_at = :now WHERE id = :id AND file_status = 'failed'");
        appendKnowledgeIdGuard(sql, expectedKnowledgeId);
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString())
                .bind("now", LocalDateTime.now())
                .bind("id", id);
        if (expectedKnowledgeId != null) {
            spec = spec.bind("kid", expectedKnowledgeId);
        }
        return applied(spec);
    }

    @Override
    public Flux<DocumentRecord> findByFilenameSuffix(String physicalFilename) {
        return documentRecordRepository.findByFilepathLike("%" + escapeLike(physicalFilename));
    }

    @Override
    public Mono<Boolean> linkContract(long id, String displayName, String contractTitle,
                                      int contractOrd, String databaseName) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(
                        "UPDATE " + TABLE + " SET filename = :filename, contract_title = :title, "
                        + "contract_ord = :ord, database_name = :databaseName WHERE id = :id")
                .bind("filename", displayName)
                .bind("ord", contractOrd)
                .bind("id", id);
        spec = bindNullable(spec, "title", contractTitle);
        spec = bindNullable(spec, "databaseName", databaseName);
        return applied(spec);
    }

    @Override
    public Mono<ScriptProcessRecord> recordRun(ScriptProcessRecord record) {
        return scriptProcessRecordRepository.save(record)
                .doOnNext(saved -> log.debug("任务执行记录已写入: script={}, id={}", saved.getScriptName(), saved.getId()));
    }

    /**
     * knowledge_id 守卫，null 表示期望记录当前没有外部 ID
     */
    private static void appendKnowledgeIdGuard(StringBuilder sql, String expectedKnowledgeId) {
        if (expectedKnowledgeId == null) {
            sql.append(" AND knowledge_id IS NULL");
        } else {
            sql.append(" AND knowledge_id = :kid");
        }
    }

    private static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
                                                                  String name, String value) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, String.class);
    }

    private static Mono<Boolean> applied(DatabaseClient.GenericExecuteSpec spec) {
        return spec.fetch().rowsUpdated().map(rows -> rows > 0);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 2000) {
            return value;
        }
        return value.substring(0, 2000);
    }
}
