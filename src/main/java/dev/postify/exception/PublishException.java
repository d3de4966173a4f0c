package dev.postify.exception;

import lombok.Getter;

/**
 * Delivery to a single platform failed.
 */
@Getter
public class PublishException extends RuntimeException {

    private final String platform;

    public PublishException(String platform, String message) {
        super(message);
        this.platform = platform;
    }

    public PublishException(String platform, String message, Throwable cause) {
        super(message, cause);
        this.platform = platform;
    }
}
