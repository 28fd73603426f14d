package com.weiwo.bridge.service;

import com.weiwo.bridge.dto.DashboardStatsResponse;
import com.weiwo.bridge.dto.DocumentPageResponse;
import com.weiwo.bridge.dto.RunLogResponse;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.FileStatus;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.BusinessException;
import com.weiwo.bridge.exception.ValidationException;
import com.weiwo.bridge.repository.DocumentRecordRepository;
import com.weiwo.bridge.repository.ScriptProcessRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 运维查询与操作
 * 看板统计、台账分页、任务日志、手动触发任务、失败记录人工重试
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ErpSyncQueryService {

    private static final int RECENT_LIMIT = 5;
    private static final int LOG_LIMIT = 50;
    private static final int DEFAULT_PER_PAGE = 20;
    private static final int MAX_PER_PAGE = 200;

    private final DocumentRecordRepository documentRecordRepository;
    private final ScriptProcessRecordRepository scriptProcessRecordRepository;
    private final LedgerStore ledgerStore;
    private final KnowledgeApiClient knowledgeApiClient;
    private final DiscoveryService discoveryService;
    private final SubmissionService submissionService;
    private final StatusPollingService statusPollingService;
    private final ContractLinkService contractLinkService;

    /**
     * 各状态数量、最近失败记录与最近任务运行
     */
    public Mono<DashboardStatsResponse> getStats() {
        Mono<Map<String, Long>> counts = Flux.fromArray(FileStatus.values())
                .concatMap(status -> documentRecordRepository.countByStatus(status.getValue())
                        .map(count -> Map.entry(status.getValue(), count)))
                .<Map<String, Long>>collect(LinkedHashMap::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()))
                .map(map -> {
                    Map<String, Long> stats = new LinkedHashMap<>();
                    stats.put("total", map.values().stream().mapToLong(Long::longValue).sum());
                    stats.putAll(map);
                    return stats;
                });

        return Mono.zip(counts,
                        documentRecordRepository.findRecentFailures(RECENT_LIMIT).collectList(),
                        scriptProcessRecordRepository.findRecent(RECENT_LIMIT).collectList())
                .map(tuple -> DashboardStatsResponse.builder()
                        .stats(tuple.getT1())
                        .recentFails(tuple.getT2())
                        .recentRuns(tuple.getT3())
                        .build());
    }

    /**
     * 台账分页，按 id 倒序
     */
    public Mono<DocumentPageResponse> listDocuments(String status, int page, int perPage) {
        int safePage = Math.max(page, 1);
        int safePerPage = perPage < 1 ? DEFAULT_PER_PAGE : Math.min(perPage, MAX_PER_PAGE);
        long offset = (long) (safePage - 1) * safePerPage;

        Mono<Long> total;
        Flux<DocumentRecord> documents;
        if (status == null || status.isBlank()) {
            total = documentRecordRepository.count();
            documents = documentRecordRepository.findPage(safePerPage, offset);
        } else {
            FileStatus fileStatus = FileStatus.fromValueOrNull(status);
            if (fileStatus == null) {
                return Mono.error(new ValidationException("未知的文档状态: " + status));
            }
            total = documentRecordRepository.countByStatus(fileStatus.getValue());
            documents = documentRecordRepository.findPageByStatus(fileStatus.getValue(), safePerPage, offset);
        }

        return Mono.zip(total, documents.collectList())
                .map(tuple -> DocumentPageResponse.builder()
                        .documents(tuple.getT2())
                        .total(tuple.getT1())
                        .page(safePage)
                        .perPage(safePerPage)
                        .build());
    }

    /**
     * 最近的任务运行记录，可按任务名过滤
     */
    public Mono<RunLogResponse> getRecentRuns(String scriptName) {
        Flux<ScriptProcessRecord> runs = scriptName == null || scriptName.isBlank()
                ? scriptProcessRecordRepository.findRecent(LOG_LIMIT)
                : scriptProcessRecordRepository.findRecentByScriptName(scriptName, LOG_LIMIT);
        return runs.collectList().map(logs -> RunLogResponse.builder().logs(logs).build());
    }

    /**
     * 立即执行一次指定任务
     */
    public Mono<ScriptProcessRecord> runStage(String stage) {
        String normalized = stage == null ? "" : stage.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "discover" -> discoveryService.discover();
            case "submit" -> submissionService.submit();
            case "poll" -> statusPollingService.poll();
            case "contract" -> contractLinkService.link();
            default -> Mono.error(new ValidationException("未知的任务: " + stage + "，可选 discover|submit|poll|contract"));
        };
    }

    /**
     * 人工重试失败记录：先删除外部条目，再重置为 discover 等待下次提交
     */
    public Mono<DocumentRecord> retry(long id) {
        return ledgerStore.findById(id)
                .switchIfEmpty(Mono.error(BusinessException.resourceNotFound("台账记录", String.valueOf(id))))
                .flatMap(record -> {
                    if (record.getFileStatus() != FileStatus.FAILED) {
                        return Mono.error(BusinessException.illegalState("台账记录", String.valueOf(id),
                                record.getFileStatus().getValue()));
                    }
                    Mono<Void> remoteDelete = record.hasKnowledgeId()
                            ? knowledgeApiClient.deleteKnowledge(record.getKnowledgeId())
                            : Mono.empty();
                    return remoteDelete
                            .then(Mono.defer(() -> ledgerStore.resetFailed(id, record.getKnowledgeId())))
                            .flatMap(applied -> {
                                if (!applied) {
                                    return Mono.error(BusinessException.illegalState("台账记录", String.valueOf(id),
                                            "已被其他任务修改"));
                                }
                                log.info("人工重试: {} 已重置为 discover", record.getFilepath());
                                return ledgerStore.findById(id);
                            });
                });
    }
}
