package com.trusty.decisionservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.trusty.accesscontrol.AccessDecisionEngine;
import com.trusty.accesscontrol.DirectoryStore;
import com.trusty.accesscontrol.InvalidRequestException;
import com.trusty.accesscontrol.IsAllowedRequest;
import com.trusty.accesscontrol.Permission;
import com.trusty.accesscontrol.RequestedAccess;
import com.trusty.accesscontrol.RoleId;
import com.trusty.accesscontrol.StoreUnavailableException;
import com.trusty.accesscontrol.testing.FakeDirectoryStore;
import com.trusty.observability.CorrelationContext;
import com.trusty.observability.CorrelationContextHolder;
import com.trusty.observability.DecisionMetrics;
import com.trusty.observability.DecisionOutcome;
import com.trusty.observability.DecisionTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("DecisionService")
class DecisionServiceTest {

    private FakeDirectoryStore store;
    private DecisionMetrics metrics;
    private InMemorySpanExporter spans;
    private DecisionService service;

    @BeforeEach
    void setUp() {
        store =
                new FakeDirectoryStore()
                        .withRole("r1", "billing", Permission.of("read", "invoices/*"))
                        .assign("u1", "r1");
        metrics = new DecisionMetrics(new SimpleMeterRegistry(), "decision-service-test");
        spans = InMemorySpanExporter.create();
        var otel =
                OpenTelemetrySdk.builder()
                        .setTracerProvider(
                                SdkTracerProvider.builder()
                                        .addSpanProcessor(SimpleSpanProcessor.create(spans))
                                        .build())
                        .build();
        service =
                new DecisionService(
                        new AccessDecisionEngine(store),
                        metrics,
                        new DecisionTracer(otel.getTracer("test")));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spans.reset();
    }

    private static IsAllowedRequest request(String user, String action, String resource) {
        return new IsAllowedRequest(user, "billing", action, resource);
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("allowed decisions are counted and traced")
        void allowed() {
            assertThat(service.decide(request("u1", "read", "invoices/123")).result()).isTrue();

            assertThat(metrics.count(DecisionOutcome.ALLOWED)).isEqualTo(1.0);
            SpanData span = spans.getFinishedSpanItems().get(0);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("access.outcome")))
                    .isEqualTo("allowed");
        }

        @Test
        @DisplayName("denied decisions are counted as denied")
        void denied() {
            assertThat(service.decide(request("u1", "write", "invoices/123")).result()).isFalse();

            assertThat(metrics.count(DecisionOutcome.DENIED)).isEqualTo(1.0);
            assertThat(metrics.count(DecisionOutcome.ALLOWED)).isZero();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("invalid requests are rethrown and counted as invalid")
        void invalid() {
            assertThatThrownBy(() -> service.decide(request("", "read", "invoices/1")))
                    .isInstanceOf(InvalidRequestException.class);

            assertThat(metrics.count(DecisionOutcome.INVALID)).isEqualTo(1.0);
            assertThat(store.totalCalls()).isZero();
        }

        @Test
        @DisplayName("store failures are rethrown, counted, and mark the span ERROR")
        void storeUnavailable() {
            store.failRoleLookup("connection refused");

            assertThatThrownBy(() -> service.decide(request("u1", "read", "invoices/1")))
                    .isInstanceOf(StoreUnavailableException.class);

            assertThat(metrics.count(DecisionOutcome.STORE_UNAVAILABLE)).isEqualTo(1.0);
            assertThat(metrics.count(DecisionOutcome.DENIED)).isZero();
            assertThat(spans.getFinishedSpanItems().get(0).getStatus().getStatusCode())
                    .isEqualTo(StatusCode.ERROR);
        }

        @Test
        @DisplayName("unexpected failures are rethrown and counted as error")
        void unexpectedFailure() {
            DirectoryStore broken =
                    new DirectoryStore() {
                        @Override
                        public Set<RoleId> getRoleIdsForUser(String externalUserId) {
                            throw new IllegalStateException("role index corrupted");
                        }

                        @Override
                        public Set<RoleId> getRolesMatchingRequest(
                                Set<RoleId> roleIds, RequestedAccess access, String namespace) {
                            return Set.of();
                        }
                    };
            var failing =
                    new DecisionService(
                            new AccessDecisionEngine(broken),
                            metrics,
                            new DecisionTracer(OpenTelemetry.noop().getTracer("test")));

            assertThatThrownBy(() -> failing.decide(request("u1", "read", "invoices/1")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("role index corrupted");

            assertThat(metrics.count(DecisionOutcome.ERROR)).isEqualTo(1.0);
            assertThat(metrics.count(DecisionOutcome.DENIED)).isZero();
        }
    }

    @Nested
    @DisplayName("correlation scope")
    class CorrelationScope {

        @Test
        @DisplayName("actor and namespace are in MDC during the decision only")
        void scopesMdc() {
            var seenUser = new AtomicReference<String>();
            var seenNamespace = new AtomicReference<String>();
            var seenCorrelation = new AtomicReference<String>();
            DirectoryStore observingStore =
                    new DirectoryStore() {
                        @Override
                        public Set<RoleId> getRoleIdsForUser(String externalUserId) {
                            seenUser.set(MDC.get("externalUserId"));
                            seenNamespace.set(MDC.get("namespace"));
                            seenCorrelation.set(MDC.get("correlationId"));
                            return store.getRoleIdsForUser(externalUserId);
                        }

                        @Override
                        public Set<RoleId> getRolesMatchingRequest(
                                Set<RoleId> roleIds, RequestedAccess access, String namespace) {
                            return store.getRolesMatchingRequest(roleIds, access, namespace);
                        }
                    };
            var observing =
                    new DecisionService(
                            new AccessDecisionEngine(observingStore),
                            metrics,
                            new DecisionTracer(OpenTelemetry.noop().getTracer("test")));
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            observing.decide(request("u1", "read", "invoices/1"));

            assertThat(seenUser.get()).isEqualTo("u1");
            assertThat(seenNamespace.get()).isEqualTo("billing");
            assertThat(seenCorrelation.get()).isEqualTo("corr-1");
            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("externalUserId")).isNull();
            assertThat(MDC.get("namespace")).isNull();
        }

        @Test
        @DisplayName("a decision outside a request still gets a correlation ID and leaves none behind")
        void generatesCorrelationOutsideRequest() {
            service.decide(request("u1", "read", "invoices/1"));

            SpanData span = spans.getFinishedSpanItems().get(0);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("correlation.id")))
                    .isNotBlank();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
