package dev.postify.exception;

/**
 * Unchecked exception wrapping data access failures of the ledger or the
 * candidate store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
