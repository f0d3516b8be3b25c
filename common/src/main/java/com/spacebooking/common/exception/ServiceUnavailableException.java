package com.spacebooking.common.exception;

/**
 * A dependency needed to answer the request is temporarily unreachable.
 * Always retryable; mapped to HTTP 503.
 */
public class ServiceUnavailableException extends BusinessException {

    public ServiceUnavailableException(String message, String errorCode) {
        super(message, null, errorCode, true);
    }

    public ServiceUnavailableException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode, true);
    }
}
