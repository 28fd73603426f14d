package com.weiwo.bridge.service;

import com.weiwo.bridge.dto.ScanResult;
import com.weiwo.bridge.dto.ScannedFile;
import com.weiwo.bridge.dto.UpsertOutcome;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.utils.DateUtils;
import com.weiwo.bridge.utils.ErrorHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 文件发现任务
 *
 * <p>一次运行只做一次目录扫描和一次台账快照读取，按集合差分类：
 * 新增 = 扫描 − 台账，候选 = 扫描 ∩ 台账，删除 = 台账 − 扫描 − 不可读。</p>
 *
 * <p>持有外部 ID 的记录在重置或标记删除之前先删除远端条目；远端删除失败时本次不改动该记录，
 * 下次运行重试，避免在外部系统中留下无人引用的条目。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryService {

    public static final String SCRIPT_NAME = "discover_files";

    private final FileSystemScanner fileSystemScanner;
    private final LedgerStore ledgerStore;
    private final KnowledgeApiClient knowledgeApiClient;
    private final StageExecutor stageExecutor;
    private final ErrorHandler errorHandler;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Mono<ScriptProcessRecord> discover() {
        return stageExecutor.execute(SCRIPT_NAME, running, this::reconcile);
    }

    private Mono<Void> reconcile(StageRun run) {
        Mono<ScanResult> scan = Mono.fromCallable(fileSystemScanner::scan)
                .subscribeOn(Schedulers.boundedElastic());

        return scan.zipWith(ledgerStore.snapshotActive())
                .flatMap(tuple -> apply(run, tuple.getT1(), tuple.getT2()));
    }

    private Mono<Void> apply(StageRun run, ScanResult scan, NavigableMap<String, DocumentRecord> ledger) {
        NavigableMap<String, ScannedFile> current = scan.files();

        List<ScannedFile> inserted = new ArrayList<>();
        List<ScannedFile> candidates = new ArrayList<>();
        for (Map.Entry<String, ScannedFile> entry : current.entrySet()) {
            if (ledger.containsKey(entry.getKey())) {
                candidates.add(entry.getValue());
            } else {
                inserted.add(entry.getValue());
            }
        }
        List<DocumentRecord> removed = new ArrayList<>();
        for (Map.Entry<String, DocumentRecord> entry : ledger.entrySet()) {
            if (!current.containsKey(entry.getKey()) && !scan.isUnreadable(entry.getKey())) {
                removed.add(entry.getValue());
            }
        }

        run.processed(current.size());
        log.info("发现任务分类完成: 扫描={} 台账={} 新增={} 候选={} 删除={} 不可读={}",
                current.size(), ledger.size(), inserted.size(), candidates.size(), removed.size(),
                scan.unreadable().size());

        return Flux.fromIterable(inserted)
                .concatMap(file -> insert(run, file))
                .thenMany(Flux.fromIterable(candidates)
                        .concatMap(file -> refresh(run, file, ledger.get(file.filepath()))))
                .thenMany(Flux.fromIterable(removed)
                        .concatMap(record -> remove(run, record)))
                .then();
    }

    private Mono<Void> insert(StageRun run, ScannedFile file) {
        return ledgerStore.upsertDiscovered(file.filepath(), file.size(), file.mtime())
                .doOnNext(outcome -> {
                    switch (outcome) {
                        case INSERTED -> {
                            run.inserted();
                            log.info("发现新文件: {} ({} bytes)", file.filepath(), file.size());
                        }
                        case UPDATED -> run.updated();
                        case IGNORED -> log.info("路径已标记为 deleted，不再跟踪: {}", file.filepath());
                        default -> log.debug("新增路径无需写入: {} outcome={}", file.filepath(), outcome);
                    }
                })
                .then();
    }

    private Mono<Void> refresh(StageRun run, ScannedFile file, DocumentRecord record) {
        boolean unchanged = record.getFileSize() != null && record.getFileSize() == file.size()
                && DateUtils.sameModifiedTime(record.getLastModifiedTime(), file.mtime());
        if (unchanged) {
            return Mono.empty();
        }
        if (record.getFileStatus() == FileStatus.PROCESSING) {
            log.info("文件已变化但正在处理中，推迟到下次发现: {}", file.filepath());
            return Mono.empty();
        }

        String knowledgeId = record.hasKnowledgeId() ? record.getKnowledgeId() : null;
        Mono<Void> remoteDelete = knowledgeId != null
                ? knowledgeApiClient.deleteKnowledge(knowledgeId)
                : Mono.empty();

        return remoteDelete
                .then(Mono.defer(() -> ledgerStore.upsertDiscovered(
                        file.filepath(), file.size(), file.mtime(), record.getKnowledgeId())))
                .doOnNext(outcome -> {
                    if (outcome == UpsertOutcome.UPDATED) {
                        run.updated();
                        log.info("文件已变化，重置为 discover: {} (原状态 {})", file.filepath(), record.getFileStatus());
                    }
                })
                .onErrorResume(ExternalApiException.class, e -> {
                    errorHandler.logError(ErrorHandler.classify(e), file.filepath(), "refresh",
                            "删除旧知识条目失败，推迟到下次发现: " + e.getMessage(), Map.of("knowledgeId", knowledgeId));
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> remove(StageRun run, DocumentRecord record) {
        String knowledgeId = record.hasKnowledgeId() ? record.getKnowledgeId() : null;
        Mono<Void> remoteDelete = knowledgeId != null
                ? knowledgeApiClient.deleteKnowledge(knowledgeId)
                : Mono.empty();

        return remoteDelete
                .then(Mono.defer(() -> ledgerStore.markDeleted(record.getFilepath(), record.getKnowledgeId())))
                .doOnNext(applied -> {
                    if (applied) {
                        run.deleted();
                        log.info("文件已从目录中移除，标记为 deleted: {}", record.getFilepath());
                    } else {
                        log.info("记录已被其他任务修改，本次不标记删除: {}", record.getFilepath());
                    }
                })
                .onErrorResume(ExternalApiException.class, e -> {
                    errorHandler.logError(ErrorHandler.classify(e), record.getFilepath(), "remove",
                            "删除知识条目失败，下次发现重试: " + e.getMessage(), Map.of("knowledgeId", knowledgeId));
                    return Mono.empty();
                })
                .then();
    }
}
