package com.weiwo.bridge.config;

import com.weiwo.bridge.exception.ApiException;
import com.weiwo.bridge.exception.BusinessException;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.exception.FileScanException;
import com.weiwo.bridge.exception.ValidationException;
import com.weiwo.bridge.utils.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运维接口全局异常处理
 * 响应体统一为 {returnCode, returnMessage, result, traceId, success}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(ValidationException ex) {
        log.warn("参数验证异常: {}", ex.getMessage());
        return respond(ex.getErrorCode(), "参数验证失败: " + ex.getMessage(), ex.getTraceId());
    }

    /**
     * 任务正在运行(409)、记录不存在(404)、状态不允许重试(409)
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusinessException(BusinessException ex) {
        log.warn("业务规则拒绝: errorCode={}, message={}", ex.getErrorCode(), ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getTraceId());
    }

    /**
     * 手动重试时删除远端条目失败
     */
    @ExceptionHandler(ExternalApiException.class)
    public ResponseEntity<Map<String, Object>> handleExternalApiException(ExternalApiException ex) {
        log.error("知识库接口异常: api={}, statusCode={}, message={}",
                ex.getApiName(), ex.getStatusCode(), ex.getRemoteMessage());
        ResponseEntity<Map<String, Object>> response = respond(ex.getErrorCode(), ex.getMessage(), ex.getTraceId());
        response.getBody().put("apiName", ex.getApiName());
        response.getBody().put("remoteStatus", ex.getStatusCode());
        return response;
    }

    @ExceptionHandler(FileScanException.class)
    public ResponseEntity<Map<String, Object>> handleFileScanException(FileScanException ex) {
        log.error("扫描目录异常: root={}, message={}", ex.getRoot(), ex.getMessage());
        ResponseEntity<Map<String, Object>> response = respond(ex.getErrorCode(), ex.getMessage(), ex.getTraceId());
        response.getBody().put("root", ex.getRoot());
        return response;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiException(ApiException ex) {
        log.error("同步服务异常: errorCode={}, message={}, traceId={}",
                ex.getErrorCode(), ex.getMessage(), ex.getTraceId(), ex);
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getTraceId());
    }

    /**
     * 路径变量类型错误（如 /documents/abc/retry）、缺少参数
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleServerWebInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("请求参数错误: {}, 请求路径: {}", ex.getReason(), exchange.getRequest().getPath());
        return respond(400, "参数错误: " + ex.getReason(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("非法参数: {}, 请求路径: {}", ex.getMessage(), exchange.getRequest().getPath());
        return respond(400, "参数错误: " + ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("未知异常: {}, 请求路径: {}", ex.getMessage(), exchange.getRequest().getPath(), ex);
        return respond(500, "系统异常，请联系管理员", null);
    }

    private ResponseEntity<Map<String, Object>> respond(int errorCode, String message, String traceId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("returnCode", errorCode);
        body.put("returnMessage", message);
        body.put("result", "");
        body.put("traceId", traceId != null ? traceId : LoggingUtils.generateTraceId());
        body.put("success", false);
        return new ResponseEntity<>(body, toHttpStatus(errorCode));
    }

    private HttpStatus toHttpStatus(int errorCode) {
        HttpStatus status = HttpStatus.resolve(errorCode);
        if (status == null) {
            return errorCode >= 500 ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.BAD_REQUEST;
        }
        return status;
    }
}
