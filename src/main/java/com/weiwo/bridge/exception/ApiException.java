package com.weiwo.bridge.exception;

import com.weiwo.bridge.utils.LoggingUtils;

/**
 * 同步服务业务异常基类
 * errorCode 沿用 HTTP 语义，便于运维接口直接映射响应码；
 * 在任务运行中抛出时沿用当前任务的 traceId
 */
public class ApiException extends RuntimeException {

    private final int errorCode;
    private final String traceId;

    public ApiException(String message, int errorCode) {
        this(message, errorCode, (Throwable) null);
    }

    public ApiException(String message, int errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.traceId = currentTraceId();
    }

    public int getErrorCode() {
        return errorCode;
    }

    public String getTraceId() {
        return traceId;
    }

    private static String currentTraceId() {
        String traceId = LoggingUtils.getCurrentTraceId();
        return traceId != null ? traceId : LoggingUtils.generateTraceId();
    }
}
