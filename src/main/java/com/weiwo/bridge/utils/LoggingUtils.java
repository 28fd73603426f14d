package com.weiwo.bridge.utils;

import com.weiwo.bridge.entity.ScriptProcessRecord;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 日志工具类
 * 提供任务运行跟踪、外部调用耗时、业务指标记录
 */
@Slf4j
public final class LoggingUtils {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String STAGE_KEY = "stage";
    public static final String FILEPATH_KEY = "filepath";

    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("PERFORMANCE");

    /** 超过该耗时的任务运行记为慢任务 */
    private static final long SLOW_RUN_THRESHOLD_MS = 60_000L;
    private static final long SLOW_CALL_THRESHOLD_MS = 5_000L;

    // 存储任务开始时间
    private static final Map<String, Long> runStartTimes = new ConcurrentHashMap<>();

    private LoggingUtils() {
    }

    /**
     * 开始任务跟踪，返回 traceId
     */
    public static String startRunTrace(String stage) {
        String traceId = generateTraceId();
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(STAGE_KEY, stage);
        runStartTimes.put(traceId, System.currentTimeMillis());
        log.debug("任务开始: stage={}, traceId={}", stage, traceId);
        return traceId;
    }

    /**
     * 结束任务跟踪并输出性能日志
     * record 为空表示审计记录未写入；MDC 只在当前线程仍属于该任务时清除
     */
    public static void endRunTrace(String traceId, String stage, ScriptProcessRecord record) {
        try {
            Long startTime = runStartTimes.remove(traceId);
            if (startTime == null) {
                return;
            }
            long duration = System.currentTimeMillis() - startTime;
            if (duration > SLOW_RUN_THRESHOLD_MS) {
                PERFORMANCE_LOGGER.warn("慢任务警告: {} 耗时: {}ms", stage, duration);
            } else {
                PERFORMANCE_LOGGER.debug("任务完成: {} 耗时: {}ms", stage, duration);
            }
            if (record != null) {
                logBusinessMetric(stage + ".run", record.getStatus(), Map.of(
                        "process", nullToZero(record.getProcessCount()),
                        "insert", nullToZero(record.getInsertCount()),
                        "update", nullToZero(record.getUpdateCount()),
                        "delete", nullToZero(record.getDeleteCount())));
            }
        } finally {
            if (traceId.equals(MDC.get(TRACE_ID_KEY))) {
                clearMDC();
            }
        }
    }

    /**
     * 已开始但尚未结束的任务数
     */
    public static int activeRunCount() {
        return runStartTimes.size();
    }

    /**
     * 记录外部接口调用耗时
     */
    public static void logExternalCall(String apiName, long durationMs, boolean success) {
        if (durationMs > SLOW_CALL_THRESHOLD_MS) {
            PERFORMANCE_LOGGER.warn("慢接口调用: {} 耗时: {}ms 成功: {}", apiName, durationMs, success);
        } else {
            PERFORMANCE_LOGGER.debug("接口调用: {} 耗时: {}ms 成功: {}", apiName, durationMs, success);
        }
    }

    /**
     * 记录业务指标
     */
    public static void logBusinessMetric(String metricName, Object value, Map<String, Object> tags) {
        StringBuilder tagStr = new StringBuilder();
        if (tags != null && !tags.isEmpty()) {
            tags.forEach((key, val) -> tagStr.append(key).append("=").append(val).append(" "));
        }
        PERFORMANCE_LOGGER.info("业务指标: {} 值: {} 标签: {}", metricName, value, tagStr.toString().trim());
    }

    public static String getCurrentTraceId() {
        return MDC.get(TRACE_ID_KEY);
    }

    private static int nullToZero(Integer value) {
        return value != null ? value : 0;
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private static void clearMDC() {
        MDC.remove(TRACE_ID_KEY);
        MDC.remove(STAGE_KEY);
        MDC.remove(FILEPATH_KEY);
    }
}
