package com.weiwo.bridge.service;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.dto.KnowledgeInfo;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.exception.KnowledgeNotFoundException;
import com.weiwo.bridge.utils.ErrorHandler;
import com.weiwo.bridge.utils.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 状态轮询任务
 * 逐条查询 pending/processing 记录的外部解析状态，直到进入终态
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusPollingService {

    public static final String SCRIPT_NAME = "polling_task";

    static final String MISSING_KNOWLEDGE_ID = "missing knowledge id";
    static final String EXTERNAL_NOT_FOUND = "external record not found";
    static final String UNKNOWN_REMOTE_ERROR = "unknown error";

    private final ApplicationProperties applicationProperties;
    private final LedgerStore ledgerStore;
    private final KnowledgeApiClient knowledgeApiClient;
    private final StageExecutor stageExecutor;
    private final ErrorHandler errorHandler;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong resumeAfterId = new AtomicLong(0L);

    public Mono<ScriptProcessRecord> poll() {
        return stageExecutor.execute(SCRIPT_NAME, running, run -> pollPage(run, resumeAfterId.get()));
    }

    /**
     * 键集分页遍历全部 pending/processing 记录。
     * 配置了 poll-max-per-run 时单次运行达到上限即停止，下次运行从上次停下的 id 之后继续，遍历到末尾后回到开头
     */
    private Mono<Void> pollPage(StageRun run, long afterId) {
        ApplicationProperties.Sync syncConfig = applicationProperties.getSync();
        int maxPerRun = syncConfig.getPollMaxPerRun();
        int limit = syncConfig.getPollBatchSize();
        if (maxPerRun > 0) {
            int remaining = maxPerRun - run.getProcessCount();
            if (remaining <= 0) {
                resumeAfterId.set(afterId);
                log.info("本次轮询已达上限 {}，下次从 id>{} 继续", maxPerRun, afterId);
                return Mono.empty();
            }
            limit = Math.min(limit, remaining);
        }
        int pageSize = limit;

        return ledgerStore.listActive(afterId, pageSize)
                .collectList()
                .flatMap(page -> {
                    if (page.isEmpty()) {
                        resumeAfterId.set(0L);
                        return Mono.empty();
                    }
                    long lastId = page.get(page.size() - 1).getId();
                    Mono<Void> next = page.size() < pageSize
                            ? Mono.fromRunnable(() -> resumeAfterId.set(0L))
                            : Mono.defer(() -> pollPage(run, lastId));
                    return pace(page, syncConfig.getPollRequestInterval())
                            .concatMap(record -> pollOne(run, record))
                            .then(next);
                });
    }

    private Flux<DocumentRecord> pace(List<DocumentRecord> page, Duration interval) {
        Flux<DocumentRecord> records = Flux.fromIterable(page);
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return records;
        }
        return records.delayElements(interval);
    }

    private Mono<Void> pollOne(StageRun run, DocumentRecord record) {
        run.processed();
        if (!record.hasKnowledgeId()) {
            errorHandler.logError(ErrorType.INVARIANT, record.getFilepath(), "poll",
                    "记录处于 " + record.getFileStatus() + " 但没有 knowledge_id", Map.of("id", record.getId()));
            return ledgerStore.finalize(record.getId(), FileStatus.FAILED, MISSING_KNOWLEDGE_ID)
                    .doOnNext(applied -> countChange(run, applied))
                    .then();
        }

        String knowledgeId = record.getKnowledgeId();
        return knowledgeApiClient.getKnowledge(knowledgeId)
                .flatMap(info -> applyRemoteStatus(run, record, info))
                .onErrorResume(ExternalApiException.class, e -> handleRemoteError(run, record, e));
    }

    private Mono<Void> applyRemoteStatus(StageRun run, DocumentRecord record, KnowledgeInfo info) {
        FileStatus remote = FileStatus.fromValueOrNull(info.parseStatus());
        if (remote == null || remote == FileStatus.DISCOVER || remote == FileStatus.DELETED) {
            log.warn("未知的外部解析状态，保持不变: {} knowledgeId={} parse_status={}",
                    record.getFilepath(), record.getKnowledgeId(), info.parseStatus());
            return Mono.empty();
        }
        if (remote == record.getFileStatus()) {
            return Mono.empty();
        }

        log.info("状态变化: {} {} -> {}", record.getFilepath(), record.getFileStatus(), remote);
        Mono<Boolean> update = switch (remote) {
            case COMPLETED -> ledgerStore.finalize(record.getId(), record.getKnowledgeId(), FileStatus.COMPLETED, null);
            case FAILED -> ledgerStore.finalize(record.getId(), record.getKnowledgeId(), FileStatus.FAILED,
                    info.errorMessage() != null && !info.errorMessage().isBlank()
                            ? info.errorMessage()
                            : UNKNOWN_REMOTE_ERROR);
            default -> ledgerStore.updateStatus(record.getId(), record.getKnowledgeId(), remote);
        };
        return update.doOnNext(applied -> countChange(run, applied)).then();
    }

    private Mono<Void> handleRemoteError(StageRun run, DocumentRecord record, ExternalApiException error) {
        if (error instanceof KnowledgeNotFoundException notFound) {
            errorHandler.logError(ErrorType.REMOTE_DEFINITIVE, record.getFilepath(), "poll",
                    "外部系统中不存在该条目", Map.of("knowledgeId", notFound.getKnowledgeId()));
            return ledgerStore.finalize(record.getId(), record.getKnowledgeId(), FileStatus.FAILED, EXTERNAL_NOT_FOUND)
                    .doOnNext(applied -> countChange(run, applied))
                    .then();
        }
        if (isDefinitive(error)) {
            errorHandler.logError(ErrorType.REMOTE_DEFINITIVE, record.getFilepath(), "poll",
                    error.getMessage(), Map.of("knowledgeId", record.getKnowledgeId()));
            return ledgerStore.finalize(record.getId(), record.getKnowledgeId(), FileStatus.FAILED,
                            error.getRemoteMessage())
                    .doOnNext(applied -> countChange(run, applied))
                    .then();
        }
        // 暂时性错误以及 2xx 但 success=false 的响应，保持状态下次再查
        errorHandler.logError(ErrorType.REMOTE_TRANSIENT, record.getFilepath(), "poll",
                error.getMessage(), Map.of("knowledgeId", record.getKnowledgeId()));
        return Mono.empty();
    }

    /**
     * 404、408、429 以外的 4xx 视为确定性失败
     */
    static boolean isDefinitive(ExternalApiException error) {
        int status = error.getStatusCode();
        return status >= 400 && status < 500 && !error.isTransient() && status != 404;
    }

    private static void countChange(StageRun run, boolean applied) {
        if (applied) {
            run.updated();
        }
    }
}
