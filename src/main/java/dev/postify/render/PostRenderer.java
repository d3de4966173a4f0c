package dev.postify.render;

import java.util.Map;

/**
 * Turns a template body and a tenant context into post text.
 * Implementations must fail on undefined context fields rather than
 * rendering blanks.
 */
public interface PostRenderer {

    /**
     * @throws dev.postify.exception.TemplateRenderException on undefined fields or syntax errors
     */
    String render(String templateBody, Map<String, Object> context);
}
