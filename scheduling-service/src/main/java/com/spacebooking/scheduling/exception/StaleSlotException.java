package com.spacebooking.scheduling.exception;

import com.spacebooking.common.exception.BusinessException;

/**
 * A slot changed (or the per-day lock could not be taken) between reading and writing.
 * Signals that the whole commit attempt should be repeated on fresh state.
 */
public class StaleSlotException extends BusinessException {

    public StaleSlotException(String message) {
        super(message, null, "STALE_SLOT", true);
    }

    public StaleSlotException(String message, Throwable cause) {
        super(message, cause, "STALE_SLOT", true);
    }
}
