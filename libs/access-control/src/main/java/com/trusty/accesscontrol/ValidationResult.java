package com.trusty.accesscontrol;

import java.util.List;

/**
 * Result of validating an {@link IsAllowedRequest}.
 *
 * @param valid  true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
