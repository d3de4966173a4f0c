package dev.postify.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * What the approval channel gets to show the decision-maker.
 */
public record CandidateSummary(
        Long candidateId,
        String tenantId,
        String tenantName,
        String industry,
        String city,
        String templateKey,
        TemplateCategory category,
        String text,
        String mediaUrl,
        List<String> platforms,
        LocalDateTime slotTime) {
}
