package com.spacebooking.scheduling.exception;

import com.spacebooking.common.exception.BusinessException;

/**
 * Malformed time interval (zero or negative duration, outside the day, unparsable time).
 * Raised during local validation; the request never reaches the slot store.
 */
public class InvalidIntervalException extends BusinessException {

    public InvalidIntervalException(String message) {
        super(message, "INVALID_INTERVAL");
    }
}
