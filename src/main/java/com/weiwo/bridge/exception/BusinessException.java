package com.weiwo.bridge.exception;

/**
 * 业务规则异常
 */
public class BusinessException extends ApiException {

    public BusinessException(String message) {
        super(message, 422);
    }

    public BusinessException(String message, int errorCode) {
        super(message, errorCode);
    }

    public static BusinessException resourceNotFound(String resourceType, String identifier) {
        return new BusinessException(String.format("%s不存在: %s", resourceType, identifier), 404);
    }

    public static BusinessException illegalState(String resourceType, String identifier, String state) {
        return new BusinessException(String.format("%s[%s]当前状态为%s，不允许该操作", resourceType, identifier, state), 409);
    }
}
