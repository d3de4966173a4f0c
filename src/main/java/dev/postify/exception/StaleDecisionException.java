package dev.postify.exception;

import dev.postify.model.CandidateStatus;
import dev.postify.model.Decision;
import lombok.Getter;

/**
 * A decision arrived for a candidate that is no longer PENDING. Not a failure:
 * somebody else (another click, the sweeper) resolved it first.
 */
@Getter
public class StaleDecisionException extends RuntimeException {

    private final Long candidateId;
    private final Decision decision;
    private final CandidateStatus currentStatus;

    public StaleDecisionException(Long candidateId, Decision decision, CandidateStatus currentStatus) {
        super(String.format("Candidate %d is %s, ignoring %s", candidateId, currentStatus, decision));
        this.candidateId = candidateId;
        this.decision = decision;
        this.currentStatus = currentStatus;
    }
}
