package dev.postify.model;

import java.util.List;

/**
 * A rendered draft that was not persisted.
 */
public record DraftPreview(
        String tenantId,
        String tenantName,
        long monthlyCount,
        String templateKey,
        TemplateCategory category,
        String text,
        String mediaUrl,
        List<String> platforms) {
}
