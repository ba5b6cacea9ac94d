package com.trusty.accesscontrol;

import java.util.List;

/**
 * Parsed resource pattern: a {@code /}-delimited path where each segment is
 *
 * <ul>
 *   <li>a literal, equal to the request segment at the same position,
 *   <li>{@value #ANY_SEGMENT}, matching exactly one arbitrary segment,
 *   <li>{@value #ANY_REMAINING}, only as the last segment, matching every remaining request segment
 *       (zero or more).
 * </ul>
 *
 * <p>Without a trailing {@value #ANY_REMAINING} the pattern and the resource must have the same
 * segment count. Examples:
 *
 * <pre>
 * orders/*   matches orders/42           but not orders/42/items
 * orders/**  matches orders, orders/42 and orders/42/items
 * **         matches everything, including the empty path
 * </pre>
 *
 * <p>WHY no regex: the grammar is evaluated segment by segment in a single pass, and restricting
 * {@value #ANY_REMAINING} to the tail leaves no backtracking to do. Wildcards are whole segments
 * only; {@code ord*} is the literal segment "ord*".
 */
public final class ResourcePattern {

    public static final String SEPARATOR = "/";
    public static final String ANY_SEGMENT = "*";
    public static final String ANY_REMAINING = "**";

    private final String pattern;
    private final List<String> fixedSegments;
    private final boolean matchesRemaining;

    private ResourcePattern(String pattern, List<String> fixedSegments, boolean matchesRemaining) {
        this.pattern = pattern;
        this.fixedSegments = fixedSegments;
        this.matchesRemaining = matchesRemaining;
    }

    /**
     * Parses a resource pattern.
     *
     * @param pattern the raw pattern, e.g. {@code "invoices/*"}
     * @return the parsed pattern
     * @throws IllegalArgumentException if the pattern is null or uses {@value #ANY_REMAINING}
     *     anywhere but the final segment
     */
    public static ResourcePattern parse(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("resource pattern must not be null");
        }
        List<String> segments = segments(pattern);
        int last = segments.size() - 1;
        for (int i = 0; i < last; i++) {
            if (ANY_REMAINING.equals(segments.get(i))) {
                throw new IllegalArgumentException(
                        "'%s' may only be the final segment of resource pattern '%s'"
                                .formatted(ANY_REMAINING, pattern));
            }
        }
        boolean trailing = last >= 0 && ANY_REMAINING.equals(segments.get(last));
        List<String> fixed = trailing ? segments.subList(0, last) : segments;
        return new ResourcePattern(pattern, List.copyOf(fixed), trailing);
    }

    /**
     * Checks whether a concrete resource path is covered by this pattern.
     *
     * @param resource the requested resource path
     * @return true if every pattern segment accepts the request segment at its position and the
     *     segment counts line up
     */
    public boolean matches(String resource) {
        if (resource == null) {
            return false;
        }
        List<String> requested = segments(resource);
        if (matchesRemaining) {
            if (requested.size() < fixedSegments.size()) {
                return false;
            }
        } else if (requested.size() != fixedSegments.size()) {
            return false;
        }
        for (int i = 0; i < fixedSegments.size(); i++) {
            String segment = fixedSegments.get(i);
            if (!ANY_SEGMENT.equals(segment) && !segment.equals(requested.get(i))) {
                return false;
            }
        }
        return true;
    }

    /** The pattern as written. */
    public String pattern() {
        return pattern;
    }

    /** Whether the pattern ends in {@value #ANY_REMAINING}. */
    public boolean matchesRemaining() {
        return matchesRemaining;
    }

    // The empty path has zero segments; otherwise empty segments ("a//b") are kept as literals.
    static List<String> segments(String path) {
        if (path.isEmpty()) {
            return List.of();
        }
        return List.of(path.split(SEPARATOR, -1));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResourcePattern other && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
