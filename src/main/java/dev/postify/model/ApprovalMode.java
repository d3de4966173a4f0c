package dev.postify.model;

public enum ApprovalMode {
    /** Publish right after the draft is created. */
    AUTO,
    /** Hand the draft to the approval channel and wait for a decision. */
    MANUAL
}
