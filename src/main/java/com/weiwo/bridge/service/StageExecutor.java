package com.weiwo.bridge.service;

import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.BusinessException;
import com.weiwo.bridge.utils.ErrorHandler;
import com.weiwo.bridge.utils.LoggingUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 任务运行外壳
 * 负责单实例互斥、运行跟踪，以及无论成败都写入一条审计记录
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageExecutor {

    private final LedgerStore ledgerStore;
    private final ErrorHandler errorHandler;

    /**
     * 执行一次任务
     *
     * @param guard 该任务的运行标记，已在运行时返回 409 业务异常
     * @param body  任务主体；以错误结束时本次运行记为 fail
     */
    public Mono<ScriptProcessRecord> execute(String scriptName, AtomicBoolean guard,
                                             Function<StageRun, Mono<?>> body) {
        return Mono.defer(() -> {
            if (!guard.compareAndSet(false, true)) {
                return Mono.error(new BusinessException("任务正在运行: " + scriptName, 409));
            }
            String traceId = LoggingUtils.startRunTrace(scriptName);
            StageRun run = new StageRun(scriptName, traceId);
            log.info("🚀 任务开始: {} traceId={}", scriptName, traceId);

            AtomicReference<ScriptProcessRecord> finished = new AtomicReference<>();
            return body.apply(run)
                    .then(Mono.fromSupplier(run::success))
                    .onErrorResume(error -> {
                        errorHandler.logException(ErrorHandler.classify(error), null, scriptName, error,
                                Map.of("traceId", traceId));
                        return Mono.just(run.fail(describe(error)));
                    })
                    .flatMap(ledgerStore::recordRun)
                    .doOnNext(record -> {
                        finished.set(record);
                        log.info("任务结束: {} 状态={} 处理={} 新增={} 更新={} 删除={} 耗时={}s",
                                scriptName, record.getStatus(), record.getProcessCount(), record.getInsertCount(),
                                record.getUpdateCount(), record.getDeleteCount(), record.getProcessDuration());
                    })
                    // 审计记录写入失败或被取消时同样要结束跟踪
                    .doFinally(signal -> {
                        LoggingUtils.endRunTrace(traceId, scriptName, finished.get());
                        guard.set(false);
                    });
        });
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
