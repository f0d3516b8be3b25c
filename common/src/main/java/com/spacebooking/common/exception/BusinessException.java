package com.spacebooking.common.exception;

import lombok.Getter;

/**
 * Root of the domain exception hierarchy.
 * Every instance carries a machine-readable error code. {@code retryable} tells the caller
 * whether repeating the same request may succeed (contention, transient upstream failures)
 * or whether the request itself has to change.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;
    private final boolean retryable;

    public BusinessException(String message, String errorCode) {
        this(message, null, errorCode, false);
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        this(message, cause, errorCode, false);
    }

    protected BusinessException(String message, Throwable cause, String errorCode, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
