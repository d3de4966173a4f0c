package dev.postify.approval;

import dev.postify.entity.PostCandidate;
import dev.postify.exception.StaleDecisionException;
import dev.postify.metrics.RotationMetrics;
import dev.postify.model.Decision;
import dev.postify.model.DecisionOutcome;
import dev.postify.repository.PostCandidateRepository;
import dev.postify.service.CandidateDecisions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Inbound side of the approval gate: maps a channel reference back to its
 * candidate and applies the decision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalCallbackHandler {

    private final PostCandidateRepository candidateRepository;
    private final CandidateDecisions candidateDecisions;
    private final RotationMetrics metrics;

    /**
     * Apply a decision received from an approval channel.
     *
     * @param reference channel reference returned by {@link ApprovalChannel#notify}
     * @param decision  the decision
     * @param payload   rejection reason or customize instructions, may be null
     * @return the outcome, or empty if the reference is unknown or the candidate
     *         was already resolved
     */
    public Optional<DecisionOutcome> handle(String reference, Decision decision, String payload) {
        Optional<PostCandidate> candidate = candidateRepository.findByChannelReference(reference);
        if (candidate.isEmpty()) {
            log.warn("No candidate for channel reference {} - ignoring {}", reference, decision);
            return Optional.empty();
        }

        Long id = candidate.get().getId();
        try {
            DecisionOutcome outcome = candidateDecisions.decide(id, decision, payload);
            log.info("Candidate {} -> {} via {}", id, outcome.status(), reference);
            return Optional.of(outcome);
        } catch (StaleDecisionException e) {
            metrics.recordStaleDecision();
            log.info("Ignoring {} for candidate {}: already {}", decision, id, e.getCurrentStatus());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} for candidate {}: {}", decision, id, e.getMessage());
            return Optional.empty();
        }
    }
}
