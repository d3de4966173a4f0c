package dev.postify.service;

import dev.postify.model.Decision;
import dev.postify.model.DecisionOutcome;

/**
 * Entry point for decisions on pending candidates.
 */
public interface CandidateDecisions {

    /**
     * Apply a decision.
     *
     * @param candidateId the candidate
     * @param decision    what to do
     * @param payload     rejection reason or customize instructions, may be null
     * @throws dev.postify.exception.StaleDecisionException if the candidate is no longer PENDING
     */
    DecisionOutcome decide(Long candidateId, Decision decision, String payload);
}
