package com.trusty.observability;

/**
 * Immutable per-request context that ties log lines, metrics and spans of one decision together.
 *
 * <p>The transport layer creates it with just a correlation id; the decision service narrows it
 * with {@link #withDecisionScope(String, String)} once the actor and namespace are known. Every
 * non-null field is mirrored into SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId  id propagated from {@code X-Correlation-ID} or generated per request
 * @param externalUserId actor the decision is about (null outside a decision)
 * @param namespace      namespace the decision is scoped to (null outside a decision)
 */
public record CorrelationContext(String correlationId, String externalUserId, String namespace) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the actor's external user ID. */
    public static final String MDC_EXTERNAL_USER_ID = "externalUserId";

    /** MDC key for the decision namespace. */
    public static final String MDC_NAMESPACE = "namespace";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation id. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /** Same correlation id, scoped to one actor and namespace. */
    public CorrelationContext withDecisionScope(String externalUserId, String namespace) {
        return new CorrelationContext(correlationId, externalUserId, namespace);
    }
}
