package com.spacebooking.scheduling.exception;

import com.spacebooking.common.exception.BusinessException;
import com.spacebooking.scheduling.domain.model.PolicyDecision;
import lombok.Getter;

/**
 * The first failing booking policy rejected the request.
 * Terminal for this request: the caller has to change duration, date or time before retrying.
 */
@Getter
public class PolicyViolationException extends BusinessException {

    private final PolicyDecision decision;

    public PolicyViolationException(PolicyDecision decision) {
        super(decision.reason(), "POLICY_VIOLATION");
        this.decision = decision;
    }
}
