package dev.postify.model;

/**
 * Replacement text for a pending candidate.
 *
 * @param text        the new post text
 * @param templateKey template the text came from; the candidate's original key
 *                    when the text was rewritten in place
 */
public record RewrittenDraft(String text, String templateKey) {
}
