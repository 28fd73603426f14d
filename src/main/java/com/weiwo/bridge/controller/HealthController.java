package com.weiwo.bridge.controller;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.repository.ScriptProcessRecordRepository;
import com.weiwo.bridge.service.ContractLinkService;
import com.weiwo.bridge.service.DiscoveryService;
import com.weiwo.bridge.service.StatusPollingService;
import com.weiwo.bridge.service.SubmissionService;
import com.weiwo.bridge.utils.LoggingUtils;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 健康检查控制器
 * 用于验证服务运行状态和台账数据库连接
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    @Autowired
    private ApplicationProperties applicationProperties;

    @Autowired
    private ConnectionFactory connectionFactory;

    @Autowired
    private ScriptProcessRecordRepository scriptProcessRecordRepository;

    /**
     * 简单的健康检查接口
     */
    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(() -> {
            Map<String, Object> result = new HashMap<>();
            result.put("status", "UP");
            result.put("timestamp", LocalDateTime.now());
            result.put("service", "ERP知识库同步服务");
            result.put("version", "1.0.0");
            result.put("running_stages", LoggingUtils.activeRunCount());
            return result;
        });
    }

    /**
     * 数据库连接检查
     */
    @GetMapping("/health/database")
    public Mono<Map<String, Object>> databaseHealth() {
        Map<String, Object> result = new HashMap<>();
        result.put("timestamp", LocalDateTime.now());

        return Mono.usingWhen(connectionFactory.create(),
                        connection -> Flux.from(connection.createStatement("SELECT 1 AS test").execute())
                                .flatMap(queryResult -> queryResult.map((row, metadata) -> row.get("test")))
                                .next(),
                        connection -> connection.close())
                .map(testResult -> {
                    result.put("database_status", "CONNECTED");
                    result.put("test_query_result", testResult);
                    return result;
                })
                .onErrorResume(error -> {
                    log.warn("数据库健康检查失败: {}", error.getMessage());
                    result.put("database_status", "DISCONNECTED");
                    result.put("error", error.getMessage());
                    return Mono.just(result);
                });
    }

    /**
     * 配置信息检查（不含密钥）
     */
    @GetMapping("/health/config")
    public Mono<Map<String, Object>> configHealth() {
        return Mono.fromCallable(() -> {
            Map<String, Object> result = new HashMap<>();

            ApplicationProperties.Api apiConfig = applicationProperties.getApi();
            ApplicationProperties.Sync syncConfig = applicationProperties.getSync();

            result.put("api_base_url", apiConfig.getBaseUrl());
            result.put("knowledge_base_id", apiConfig.getKnowledgeBaseId());
            result.put("api_key_configured", apiConfig.getApiKey() != null && !apiConfig.getApiKey().isEmpty());
            result.put("roots", syncConfig.getRoots());
            result.put("scheduling_enabled", syncConfig.isSchedulingEnabled());
            result.put("contract_link_enabled", applicationProperties.getContract().isEnabled());
            result.put("timestamp", LocalDateTime.now());

            return result;
        });
    }

    /**
     * 各任务最近一次运行情况，任一任务最近一次失败时返回 503
     */
    @GetMapping("/health/sync")
    public Mono<ResponseEntity<Map<String, Object>>> syncHealth() {
        List<String> stages = new ArrayList<>(List.of(
                DiscoveryService.SCRIPT_NAME, SubmissionService.SCRIPT_NAME, StatusPollingService.SCRIPT_NAME));
        if (applicationProperties.getContract().isEnabled()) {
            stages.add(ContractLinkService.SCRIPT_NAME);
        }

        return Flux.fromIterable(stages)
                .concatMap(stage -> scriptProcessRecordRepository.findRecentByScriptName(stage, 1)
                        .next()
                        .map(run -> Map.entry(stage, describeRun(run)))
                        .defaultIfEmpty(Map.entry(stage, Map.<String, Object>of("status", "never_run"))))
                .<Map<String, Object>>collect(LinkedHashMap::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()))
                .map(lastRuns -> {
                    boolean degraded = lastRuns.values().stream()
                            .anyMatch(run -> ScriptProcessRecord.STATUS_FAIL.equals(((Map<?, ?>) run).get("status")));
                    Map<String, Object> result = new HashMap<>();
                    result.put("status", degraded ? "degraded" : "healthy");
                    result.put("last_runs", lastRuns);
                    result.put("timestamp", LocalDateTime.now());
                    return degraded
                            ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result)
                            : ResponseEntity.ok(result);
                });
    }

    private static Map<String, Object> describeRun(ScriptProcessRecord run) {
        Map<String, Object> summary = new HashMap<>();
        summary.put("status", run.getStatus());
        summary.put("process_timestamp", run.getProcessTimestamp());
        summary.put("process_count", run.getProcessCount());
        if (run.getFailedReason() != null) {
            summary.put("failed_reason", run.getFailedReason());
        }
        return summary;
    }
}
