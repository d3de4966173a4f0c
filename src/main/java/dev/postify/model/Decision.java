package dev.postify.model;

/**
 * Signal coming back from an approval channel (or from the sweeper).
 */
public enum Decision {
    APPROVE,
    REJECT,
    CANCEL,
    // content mutations, the candidate stays PENDING
    REGENERATE,
    CUSTOMIZE;

    public boolean isContentMutation() {
        return this == REGENERATE || this == CUSTOMIZE;
    }
}
