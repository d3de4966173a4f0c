package dev.postify.model;

import java.util.List;

/**
 * A rendered post ready to become a candidate.
 */
public record Draft(
        PostTemplate template,
        String text,
        String mediaUrl,
        List<String> platforms) {

    public Draft {
        platforms = List.copyOf(platforms);
    }
}
