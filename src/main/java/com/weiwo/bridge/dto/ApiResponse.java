package com.weiwo.bridge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * 知识库接口通用响应
 * 成功时 data 有值；success 缺省按成功处理，仅显式 false 视为失败，原因在 message / error 中
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiResponse<T>(
    @JsonProperty("success") Boolean success,
    @JsonProperty("data") T data,
    @JsonProperty("code") Integer code,
    @JsonProperty("message") String message,
    @JsonProperty("msg") String msg,
    @JsonProperty("error") Object error
) {

    /**
     * 检查响应是否成功，未携带 success 字段时视为成功
     */
    public boolean isSuccess() {
        return !Boolean.FALSE.equals(success);
    }

    /**
     * 获取错误消息
     */
    public String getErrorMessage() {
        if (message != null && !message.isBlank()) return message;
        if (msg != null && !msg.isBlank()) return msg;
        if (error instanceof Map<?, ?> map && map.get("message") != null) {
            return String.valueOf(map.get("message"));
        }
        if (error != null) return String.valueOf(error);
        return "unknown error";
    }
}
