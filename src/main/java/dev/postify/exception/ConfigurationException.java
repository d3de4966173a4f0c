package dev.postify.exception;

/**
 * Fatal configuration problem (empty template catalog, missing required
 * setting). Aborts startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
