package dev.postify.exception;

/**
 * The approval channel could not be reached.
 */
public class ApprovalChannelException extends RuntimeException {

    public ApprovalChannelException(String message) {
        super(message);
    }

    public ApprovalChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
