package com.weiwo.bridge.utils;

import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.exception.FileScanException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * 错误处理器
 * 按 ErrorType 统一记录同步过程中的错误
 */
@Slf4j
@Component
public class ErrorHandler {

    /**
     * 按异常类型归类
     */
    public static ErrorType classify(Throwable error) {
        if (error instanceof FileScanException) {
            return ErrorType.FILESYSTEM;
        }
        if (error instanceof ExternalApiException apiError) {
            return apiError.isTransient() ? ErrorType.REMOTE_TRANSIENT : ErrorType.REMOTE_DEFINITIVE;
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return ErrorType.CONTENT;
        }
        if (error instanceof DataAccessException) {
            return ErrorType.DATABASE;
        }
        return ErrorType.INVARIANT;
    }

    /**
     * 记录错误日志
     *
     * @param errorType 错误类型
     * @param filepath  文件路径，可为空
     * @param step      执行步骤
     * @param errorMsg  错误信息
     * @param params    相关参数
     */
    public void logError(ErrorType errorType, String filepath, String step, String errorMsg, Map<String, Object> params) {
        try {
            MDC.put("errorType", errorType.name());
            MDC.put("filepath", filepath != null ? filepath : "-");
            MDC.put("step", step);

            StringBuilder errorDetails = new StringBuilder();
            errorDetails.append(String.format("[%s] [文件:%s] [步骤:%s]", errorType.getDescription(), filepath, step));
            errorDetails.append(String.format(" 错误信息: %s", errorMsg));
            appendParams(errorDetails, params);

            if (errorType == ErrorType.REMOTE_TRANSIENT) {
                log.warn(errorDetails.toString());
            } else {
                log.error(errorDetails.toString());
            }
        } finally {
            MDC.remove("errorType");
            MDC.remove("filepath");
            MDC.remove("step");
        }
    }

    /**
     * 记录异常错误（包含完整堆栈信息）
     */
    public void logException(ErrorType errorType, String filepath, String step, Throwable exception, Map<String, Object> params) {
        try {
            MDC.put("errorType", errorType.name());
            MDC.put("filepath", filepath != null ? filepath : "-");
            MDC.put("step", step);
            MDC.put("exceptionClass", exception.getClass().getSimpleName());

            StringBuilder errorDetails = new StringBuilder();
            errorDetails.append(String.format("[%s] [文件:%s] [步骤:%s] 异常: %s",
                    errorType.getDescription(), filepath, step, exception.getMessage()));
            appendParams(errorDetails, params);

            log.error(errorDetails.toString(), exception);
        } finally {
            MDC.remove("errorType");
            MDC.remove("filepath");
            MDC.remove("step");
            MDC.remove("exceptionClass");
        }
    }

    private void appendParams(StringBuilder builder, Map<String, Object> params) {
        if (params != null && !params.isEmpty()) {
            builder.append(" 参数: ");
            params.forEach((key, value) -> builder.append(String.format("%s=%s ", key, value)));
        }
    }
}
