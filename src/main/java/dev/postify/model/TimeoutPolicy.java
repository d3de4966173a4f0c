package dev.postify.model;

/**
 * What the timeout sweeper does with a candidate whose decision window lapsed.
 */
public enum TimeoutPolicy {
    AUTO_POST,
    AUTO_CANCEL,
    FALLBACK
}
