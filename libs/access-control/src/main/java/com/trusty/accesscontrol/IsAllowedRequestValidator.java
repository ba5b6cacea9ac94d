package com.trusty.accesscontrol;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the shape of a decision request before any store access.
 *
 * <p>WHY manual validation: the core has no framework dependencies, and collecting every error in
 * one pass gives callers the full list instead of one round trip per missing field.
 */
public final class IsAllowedRequestValidator {

    private IsAllowedRequestValidator() {
        // utility class
    }

    /**
     * Validates a request evaluated in its own namespace.
     */
    public static ValidationResult validate(IsAllowedRequest request) {
        return validate(request, request == null ? null : request.namespace());
    }

    /**
     * Validates a request evaluated in {@code namespace}.
     *
     * <p>All four request fields must be non-blank, and when the request carries a namespace it
     * must equal the one the decision is scoped to.
     */
    public static ValidationResult validate(IsAllowedRequest request, String namespace) {
        if (request == null) {
            return ValidationResult.fail(List.of("request must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(request.externalUserId())) {
            errors.add("external_user_id must not be null or blank");
        }
        if (isBlank(namespace)) {
            errors.add("namespace must not be null or blank");
        } else if (!isBlank(request.namespace()) && !request.namespace().equals(namespace)) {
            errors.add(
                    "namespace '%s' does not match the request namespace '%s'"
                            .formatted(namespace, request.namespace()));
        }
        if (isBlank(request.action())) {
            errors.add("action must not be null or blank");
        }
        if (isBlank(request.resource())) {
            errors.add("resource must not be null or blank");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
