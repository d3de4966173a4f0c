package dev.postify.model;

import java.util.List;

/**
 * Result of applying a decision to a candidate.
 *
 * @param candidateId     the candidate the decision was applied to
 * @param status          status after the decision
 * @param platformResults per-platform publish results, empty unless approved
 */
public record DecisionOutcome(
        Long candidateId,
        CandidateStatus status,
        List<PlatformResult> platformResults) {

    public DecisionOutcome {
        platformResults = platformResults == null ? List.of() : List.copyOf(platformResults);
    }

    public static DecisionOutcome of(Long candidateId, CandidateStatus status) {
        return new DecisionOutcome(candidateId, status, List.of());
    }

    public long publishedCount() {
        return platformResults.stream()
                .filter(r -> r.outcome() == PlatformResult.Outcome.PUBLISHED)
                .count();
    }

    public boolean hasFailures() {
        return platformResults.stream().anyMatch(r -> !r.isSuccess());
    }
}
