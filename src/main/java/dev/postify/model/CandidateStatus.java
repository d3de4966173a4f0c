package dev.postify.model;

/**
 * Lifecycle state of a post candidate. Everything except PENDING is terminal.
 */
public enum CandidateStatus {
    PENDING,
    APPROVED,
    REJECTED,
    TIMEOUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
