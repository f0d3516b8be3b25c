package com.spacebooking.scheduling.exception;

import com.spacebooking.common.exception.ServiceUnavailableException;

/**
 * Commit or release gave up after the bounded number of attempts.
 * Transient: the request itself is admissible and may be retried later.
 */
public class CommitFailedException extends ServiceUnavailableException {

    public CommitFailedException(String message, Throwable cause) {
        super(message, cause, "COMMIT_FAILED");
    }
}
