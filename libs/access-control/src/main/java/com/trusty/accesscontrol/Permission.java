package com.trusty.accesscontrol;

/**
 * A single grant statement inside a role: {@code (action, resource-pattern)}.
 *
 * <p>The resource pattern is validated at construction, so a {@code Permission} instance always
 * holds a pattern that {@link ResourcePattern#parse(String)} accepts.
 *
 * @param action   operation name, or {@value #ANY_ACTION} for every action
 * @param resource resource pattern, see {@link ResourcePattern} for the grammar
 */
public record Permission(String action, String resource) {

    /** Action wildcard: grants any requested action. */
    public static final String ANY_ACTION = "*";

    public Permission {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("permission action must not be null or blank");
        }
        ResourcePattern.parse(resource);
    }

    public static Permission of(String action, String resource) {
        return new Permission(action, resource);
    }

    /** Parsed form of {@link #resource()}. */
    public ResourcePattern resourcePattern() {
        return ResourcePattern.parse(resource);
    }
}
