package dev.postify.model;

import java.util.Map;

/**
 * Advisory tuning hint for one template.
 */
public record TemplateSuggestion(
        String templateKey,
        int rejections,
        RejectionBucket dominantBucket,
        Map<RejectionBucket, Integer> buckets,
        String suggestion) {
}
