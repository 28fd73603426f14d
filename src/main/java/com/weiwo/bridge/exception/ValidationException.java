package com.weiwo.bridge.exception;

/**
 * 参数验证异常
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, 400);
    }
}
