package com.spacebooking.scheduling.api.exception;

import com.spacebooking.common.dto.BaseResponse;
import com.spacebooking.scheduling.domain.model.PolicyDecision;
import com.spacebooking.scheduling.exception.CommitFailedException;
import com.spacebooking.scheduling.exception.InvalidIntervalException;
import com.spacebooking.scheduling.exception.PolicyViolationException;
import com.spacebooking.scheduling.exception.StaleSlotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Scheduling-specific error mapping, ahead of the shared GlobalExceptionHandler.
 * Retryable failures (stale slot, exhausted commit) tell the client to try again with the same request.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SchedulingExceptionHandler {

    @ExceptionHandler(PolicyViolationException.class)
    public ResponseEntity<BaseResponse<PolicyDecision>> handlePolicyViolation(PolicyViolationException ex) {
        log.info("Policy violation [{}]: {}", ex.getDecision().reasonCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(BaseResponse.rejected(ex.getMessage(), ex.getErrorCode(), ex.getDecision()));
    }

    @ExceptionHandler(InvalidIntervalException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidInterval(InvalidIntervalException ex) {
        log.warn("Invalid interval: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), false));
    }

    @ExceptionHandler(StaleSlotException.class)
    public ResponseEntity<BaseResponse<?>> handleStaleSlot(StaleSlotException ex) {
        log.warn("Slot contention: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), true));
    }

    @ExceptionHandler(CommitFailedException.class)
    public ResponseEntity<BaseResponse<?>> handleCommitFailed(CommitFailedException ex) {
        log.warn("Commit failed after retries: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), true));
    }
}
