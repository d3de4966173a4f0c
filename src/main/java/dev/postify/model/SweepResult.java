package dev.postify.model;

/**
 * Counters from one timeout sweep.
 */
public record SweepResult(
        int examined,
        int autoPosted,
        int cancelled,
        int fallbacks,
        int alreadyResolved,
        int failed) {

    public static SweepResult empty() {
        return new SweepResult(0, 0, 0, 0, 0, 0);
    }
}
