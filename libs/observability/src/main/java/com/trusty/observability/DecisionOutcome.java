package com.trusty.observability;

/**
 * How a decision request ended, as reported to metrics and traces.
 */
public enum DecisionOutcome {

    ALLOWED("allowed"),
    DENIED("denied"),
    /** Rejected before any store access. */
    INVALID("invalid"),
    /** The directory store failed; no decision was made. */
    STORE_UNAVAILABLE("store_unavailable"),
    /** Any other failure; no decision was made. */
    ERROR("error");

    private final String tagValue;

    DecisionOutcome(String tagValue) {
        this.tagValue = tagValue;
    }

    /** Value used for the {@code outcome} metric tag and span attribute. */
    public String tagValue() {
        return tagValue;
    }

    public static DecisionOutcome of(boolean allowed) {
        return allowed ? ALLOWED : DENIED;
    }
}
