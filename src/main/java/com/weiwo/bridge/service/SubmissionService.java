package com.weiwo.bridge.service;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.dto.KnowledgeInfo;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.exception.ValidationException;
import com.weiwo.bridge.utils.ErrorHandler;
import com.weiwo.bridge.utils.ErrorType;
import com.weiwo.bridge.utils.FileHashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 文件提交任务
 * 上传 discover 记录对应的文件；失败的记录置为 failed，不自动重试
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

    public static final String SCRIPT_NAME = "submit_task";

    private final ApplicationProperties applicationProperties;
    private final LedgerStore ledgerStore;
    private final KnowledgeApiClient knowledgeApiClient;
    private final StageExecutor stageExecutor;
    private final ErrorHandler errorHandler;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Mono<ScriptProcessRecord> submit() {
        return stageExecutor.execute(SCRIPT_NAME, running, this::submitBatch);
    }

    private Mono<Void> submitBatch(StageRun run) {
        String knowledgeBaseId = applicationProperties.getApi().getKnowledgeBaseId();
        if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
            return Mono.error(new ValidationException("未配置知识库ID (app.api.knowledge-base-id)"));
        }
        ApplicationProperties.Sync syncConfig = applicationProperties.getSync();

        return ledgerStore.listByStatus(FileStatus.DISCOVER, syncConfig.getSubmitBatchSize())
                .collectList()
                .doOnNext(batch -> log.info("待提交文件: {}", batch.size()))
                .flatMapMany(Flux::fromIterable)
                .flatMap(record -> submitOne(run, knowledgeBaseId, record), syncConfig.getSubmitConcurrency())
                .then();
    }

    private Mono<Void> submitOne(StageRun run, String knowledgeBaseId, DocumentRecord record) {
        run.processed();
        Path path = Path.of(record.getFilepath());
        String algorithm = applicationProperties.getSync().getHashAlgorithm();

        return Mono.fromCallable(() -> FileHashUtils.hash(path, algorithm))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(hash -> knowledgeApiClient.uploadFile(knowledgeBaseId, path, record.getFilename())
                        .flatMap(info -> onUploaded(run, record, hash, info)))
                // 台账写失败中止本次任务，其余错误只影响当前文件
                .onErrorResume(error -> !(error instanceof DataAccessException),
                        error -> onFailed(record, error));
    }

    private Mono<Void> onUploaded(StageRun run, DocumentRecord record, String hash, KnowledgeInfo info) {
        FileStatus initialStatus = "pending".equalsIgnoreCase(info.parseStatus())
                ? FileStatus.PENDING
                : FileStatus.PROCESSING;

        return ledgerStore.transitionOnSubmit(record.getId(), initialStatus, info.id(), hash, info.filePath())
                .flatMap(applied -> {
                    if (applied) {
                        run.updated();
                        log.info("提交成功: {} knowledgeId={} status={}", record.getFilepath(), info.id(), initialStatus);
                        return Mono.<Void>empty();
                    }
                    // 记录已被其他提交任务推进，删除本次新建的远端条目避免重复
                    log.warn("记录已不是 discover，撤销本次上传: {} knowledgeId={}", record.getFilepath(), info.id());
                    return knowledgeApiClient.deleteKnowledge(info.id())
                            .onErrorResume(ExternalApiException.class, e -> {
                                errorHandler.logError(ErrorType.INVARIANT, record.getFilepath(), "submit",
                                        "撤销重复上传失败，外部系统中残留条目: " + e.getMessage(),
                                        Map.of("knowledgeId", info.id()));
                                return Mono.empty();
                            });
                });
    }

    private Mono<Void> onFailed(DocumentRecord record, Throwable error) {
        String reason = failureReason(error);
        errorHandler.logError(ErrorHandler.classify(error), record.getFilepath(), "submit", reason,
                Map.of("id", record.getId()));
        return ledgerStore.markFailed(record.getId(), reason)
                .doOnNext(applied -> {
                    if (!applied) {
                        log.info("记录已被其他任务修改，未标记失败: {}", record.getFilepath());
                    }
                })
                .then();
    }

    static String failureReason(Throwable error) {
        if (error instanceof IOException) {
            return "file unreadable: " + error.getClass().getSimpleName() + ": " + error.getMessage();
        }
        if (error instanceof ExternalApiException apiError) {
            if (apiError.getStatusCode() == 0) {
                return "upload failed: " + apiError.getRemoteMessage();
            }
            return "upload failed (HTTP " + apiError.getStatusCode() + "): " + apiError.getRemoteMessage();
        }
        String message = error.getMessage();
        return "upload failed: " + (message != null ? message : error.getClass().getSimpleName());
    }
}
