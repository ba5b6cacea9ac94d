package com.trusty.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer meters for access decisions.
 *
 * <ul>
 *   <li>{@value #DECISIONS} counter, one series per {@link DecisionOutcome}
 *   <li>{@value #DECISION_DURATION} timer, one series per {@link DecisionOutcome}
 * </ul>
 *
 * Both carry a {@code service} tag. Meters are registered eagerly so every outcome shows up at zero
 * before the first decision.
 */
public final class DecisionMetrics {

    public static final String DECISIONS = "trusty.decisions";
    public static final String DECISION_DURATION = "trusty.decision.duration";

    /** Tag key for the decision outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final Map<DecisionOutcome, Counter> counters = new EnumMap<>(DecisionOutcome.class);
    private final Map<DecisionOutcome, Timer> timers = new EnumMap<>(DecisionOutcome.class);

    /**
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public DecisionMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        for (DecisionOutcome outcome : DecisionOutcome.values()) {
            Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_OUTCOME, outcome.tagValue());
            counters.put(
                    outcome,
                    Counter.builder(DECISIONS)
                            .description("Access decisions by outcome")
                            .tags(tags)
                            .register(registry));
            timers.put(
                    outcome,
                    Timer.builder(DECISION_DURATION)
                            .description("Time taken to reach an access decision")
                            .tags(tags)
                            .register(registry));
        }
    }

    /** Records one decision and how long it took. */
    public void record(DecisionOutcome outcome, Duration elapsed) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        counters.get(outcome).increment();
        timers.get(outcome).record(elapsed);
    }

    /** Number of decisions recorded with the given outcome. */
    public double count(DecisionOutcome outcome) {
        return counters.get(outcome).count();
    }
}
