package com.weiwo.bridge.service;

import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 同步任务调度
 * fixedDelay：上一次运行结束后才开始计时，同一任务不会重叠
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.sync", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {

    private final ApplicationProperties applicationProperties;
    private final DiscoveryService discoveryService;
    private final SubmissionService submissionService;
    private final StatusPollingService statusPollingService;
    private final ContractLinkService contractLinkService;

    @Scheduled(fixedDelayString = "${app.sync.discover-interval-ms:600000}",
            initialDelayString = "${app.sync.initial-delay-ms:10000}")
    public void scheduledDiscover() {
        runBlocking("发现", discoveryService.discover());
    }

    @Scheduled(fixedDelayString = "${app.sync.submit-interval-ms:120000}",
            initialDelayString = "${app.sync.initial-delay-ms:10000}")
    public void scheduledSubmit() {
        runBlocking("提交", submissionService.submit());
    }

    @Scheduled(fixedDelayString = "${app.sync.poll-interval-ms:120000}",
            initialDelayString = "${app.sync.initial-delay-ms:10000}")
    public void scheduledPoll() {
        runBlocking("轮询", statusPollingService.poll());
    }

    @Scheduled(fixedDelayString = "${app.contract.interval-ms:3600000}",
            initialDelayString = "${app.sync.initial-delay-ms:10000}")
    public void scheduledContractLink() {
        if (!applicationProperties.getContract().isEnabled()) {
            return;
        }
        runBlocking("合同关联", contractLinkService.link());
    }

    /**
     * 定时线程上阻塞等待任务完成，保证 fixedDelay 从任务结束开始计算
     */
    private void runBlocking(String stageName, Mono<ScriptProcessRecord> stage) {
        try {
            ScriptProcessRecord record = stage.block();
            if (record != null && !record.isSuccess()) {
                log.warn("⚠️ {}任务失败: {}", stageName, record.getFailedReason());
            }
        } catch (BusinessException e) {
            log.info("{}任务跳过: {}", stageName, e.getMessage());
        } catch (Exception e) {
            log.error("❌ {}任务异常: {}", stageName, e.getMessage(), e);
        }
    }
}
