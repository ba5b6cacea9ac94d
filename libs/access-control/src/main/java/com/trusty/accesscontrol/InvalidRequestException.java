package com.trusty.accesscontrol;

import java.util.List;

/**
 * Thrown when an {@link IsAllowedRequest} is malformed. Always raised before the directory store
 * is touched.
 */
public class InvalidRequestException extends AccessControlException {

    private final List<String> errors;

    public InvalidRequestException(List<String> errors) {
        super("Invalid request: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /** Every validation error found, not just the first one. */
    public List<String> errors() {
        return errors;
    }
}
