package com.trusty.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps a decision in an OpenTelemetry span named {@value #SPAN_NAME}.
 *
 * <p>The span carries the namespace and action up front, the outcome once known, and the
 * correlation attributes of the current {@link CorrelationContextHolder}. The resource and the
 * external user id are attached only through the correlation context, never as free-form span
 * names.
 *
 * <p>Does NOT configure the SDK; services supply a {@link Tracer} from whatever SDK they boot.
 */
public final class DecisionTracer {

    public static final String SPAN_NAME = "access-control.is-allowed";

    public static final String ATTR_NAMESPACE = "access.namespace";
    public static final String ATTR_ACTION = "access.action";
    public static final String ATTR_OUTCOME = "access.outcome";
    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_EXTERNAL_USER_ID = "user.external_id";

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public DecisionTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code decision} inside a new span. If it throws, the span is marked ERROR, the exception
     * is recorded and rethrown unchanged.
     *
     * @param namespace namespace attribute, may be null
     * @param action    action attribute, may be null
     * @param decision  the work that produces the decision
     * @param outcomeOf maps the result to the outcome attribute
     * @return the result of {@code decision}
     */
    public <T> T traceDecision(
            String namespace,
            String action,
            Supplier<T> decision,
            Function<T, DecisionOutcome> outcomeOf) {
        var spanBuilder = tracer.spanBuilder(SPAN_NAME).setSpanKind(SpanKind.INTERNAL);
        if (namespace != null) {
            spanBuilder.setAttribute(ATTR_NAMESPACE, namespace);
        }
        if (action != null) {
            spanBuilder.setAttribute(ATTR_ACTION, action);
        }
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.externalUserId() != null) {
                span.setAttribute(ATTR_EXTERNAL_USER_ID, ctx.externalUserId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = decision.get();
            span.setAttribute(ATTR_OUTCOME, outcomeOf.apply(result).tagValue());
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
