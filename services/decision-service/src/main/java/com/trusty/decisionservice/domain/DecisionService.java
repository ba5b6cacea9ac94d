package com.trusty.decisionservice.domain;

import com.trusty.accesscontrol.AccessDecisionEngine;
import com.trusty.accesscontrol.InvalidRequestException;
import com.trusty.accesscontrol.IsAllowedRequest;
import com.trusty.accesscontrol.IsAllowedResult;
import com.trusty.accesscontrol.StoreUnavailableException;
import com.trusty.observability.CorrelationContext;
import com.trusty.observability.CorrelationContextHolder;
import com.trusty.observability.DecisionMetrics;
import com.trusty.observability.DecisionOutcome;
import com.trusty.observability.DecisionTracer;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one access decision with its observability around it: the actor and namespace go into MDC
 * for the duration of the call, the decision runs inside a span, and every outcome (including
 * rejections and store failures) is counted and timed.
 *
 * <p>Exceptions from the engine are rethrown unchanged for the web layer to map.
 */
@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private final AccessDecisionEngine engine;
    private final DecisionMetrics metrics;
    private final DecisionTracer tracer;

    public DecisionService(
            AccessDecisionEngine engine, DecisionMetrics metrics, DecisionTracer tracer) {
        this.engine = engine;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    /**
     * Decides whether the request is allowed.
     *
     * @throws InvalidRequestException   if a field is missing
     * @throws StoreUnavailableException if the directory cannot be read
     */
    public IsAllowedResult decide(IsAllowedRequest request) {
        CorrelationContext scope =
                CorrelationContextHolder.get()
                        .orElseGet(() -> CorrelationContext.of(UUID.randomUUID().toString()))
                        .withDecisionScope(request.externalUserId(), request.namespace());
        return CorrelationContextHolder.callWithContext(scope, () -> decideInScope(request));
    }

    private IsAllowedResult decideInScope(IsAllowedRequest request) {
        long start = System.nanoTime();
        try {
            IsAllowedResult result =
                    tracer.traceDecision(
                            request.namespace(),
                            request.action(),
                            () -> engine.isAllowed(request),
                            r -> DecisionOutcome.of(r.result()));
            metrics.record(DecisionOutcome.of(result.result()), elapsedSince(start));
            log.info(
                    "Decision {} for action '{}' on '{}'",
                    result.result() ? "ALLOWED" : "DENIED",
                    request.action(),
                    request.resource());
            return result;
        } catch (InvalidRequestException e) {
            metrics.record(DecisionOutcome.INVALID, elapsedSince(start));
            log.info("Rejected invalid decision request: {}", e.errors());
            throw e;
        } catch (StoreUnavailableException e) {
            metrics.record(DecisionOutcome.STORE_UNAVAILABLE, elapsedSince(start));
            throw e;
        } catch (RuntimeException e) {
            metrics.record(DecisionOutcome.ERROR, elapsedSince(start));
            log.error("Decision failed unexpectedly", e);
            throw e;
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
