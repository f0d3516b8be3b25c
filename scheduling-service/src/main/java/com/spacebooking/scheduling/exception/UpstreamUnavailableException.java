package com.spacebooking.scheduling.exception;

import com.spacebooking.common.exception.ServiceUnavailableException;

/**
 * An external collaborator (resource metadata, usage statistics, booking counts) could not be reached.
 */
public class UpstreamUnavailableException extends ServiceUnavailableException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause, "UPSTREAM_UNAVAILABLE");
    }

    public UpstreamUnavailableException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
