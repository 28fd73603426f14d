package com.weiwo.bridge.exception;

/**
 * 调用知识库接口失败
 * statusCode 为 0 表示请求未得到 HTTP 响应（超时、连接失败等）
 */
public class ExternalApiException extends ApiException {

    private final String apiName;
    private final int statusCode;
    private final String remoteMessage;

    public ExternalApiException(String apiName, String message, int statusCode) {
        this(apiName, message, statusCode, null);
    }

    public ExternalApiException(String apiName, String message, int statusCode, Throwable cause) {
        super(String.format("调用%s API失败: %s", apiName, message), 502, cause);
        this.apiName = apiName;
        this.statusCode = statusCode;
        this.remoteMessage = message;
    }

    public String getApiName() {
        return apiName;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 服务端返回的原始错误信息，写入 failed_msg 时使用
     */
    public String getRemoteMessage() {
        return remoteMessage;
    }

    /**
     * 是否为暂时性错误：无响应、5xx、408、429 在下个周期重试；其余 4xx 视为确定性失败
     */
    public boolean isTransient() {
        return statusCode == 0 || statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }

    public static ExternalApiException noResponse(String apiName, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ExternalApiException(apiName, reason, 0, cause);
    }
}
