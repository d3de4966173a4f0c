package dev.postify.model;

import java.util.List;

/**
 * Immutable post skeleton. The body is opaque here and handed to the renderer.
 */
public record PostTemplate(
        String key,
        TemplateCategory category,
        List<String> platforms,
        String body) {

    public PostTemplate {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }
}
