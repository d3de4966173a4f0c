package dev.postify.exception;

/**
 * A template could not be rendered for a tenant, typically because it refers
 * to a context field the tenant does not have.
 */
public class TemplateRenderException extends RuntimeException {

    public TemplateRenderException(String message) {
        super(message);
    }

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
