package dev.postify.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Output of a rejection analysis run. Purely advisory.
 */
public record RejectionReport(
        int windowDays,
        String tenantId,
        LocalDateTime generatedAt,
        int totalRejections,
        Map<String, Map<RejectionBucket, Integer>> bucketsByTemplate,
        List<TemplateSuggestion> suggestions) {
}
