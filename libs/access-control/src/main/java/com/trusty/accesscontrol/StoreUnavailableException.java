package com.trusty.accesscontrol;

/**
 * Thrown when the directory store cannot answer (connectivity, query failure, corrupt data).
 *
 * <p>Distinct from a deny: a decision that could not be made must never read as
 * {@code {result: false}}. The detail is kept as an opaque message; the underlying exception is
 * attached as the cause for logs only.
 */
public class StoreUnavailableException extends AccessControlException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
