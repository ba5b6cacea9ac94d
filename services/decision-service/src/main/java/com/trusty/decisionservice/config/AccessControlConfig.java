package com.trusty.decisionservice.config;

import com.trusty.accesscontrol.AccessDecisionEngine;
import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.config.DirectoryStoreConfig;
import com.trusty.observability.DecisionMetrics;
import com.trusty.observability.DecisionTracer;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Wires the decision engine onto the configured directory store, plus its metrics and tracing.
 *
 * <p>The {@link Tracer} comes from {@link GlobalOpenTelemetry}: a no-op unless the deployment
 * installs an SDK (e.g. the OpenTelemetry Java agent).
 */
@Configuration
@Import(DirectoryStoreConfig.class)
public class AccessControlConfig {

    @Bean
    public AccessDecisionEngine accessDecisionEngine(DirectoryRepository directoryRepository) {
        return new AccessDecisionEngine(directoryRepository);
    }

    @Bean
    public DecisionMetrics decisionMetrics(
            MeterRegistry meterRegistry, DecisionServiceProperties properties) {
        return new DecisionMetrics(meterRegistry, properties.name());
    }

    @Bean
    public Tracer decisionServiceTracer(DecisionServiceProperties properties) {
        return GlobalOpenTelemetry.getTracer(properties.name());
    }

    @Bean
    public DecisionTracer decisionTracer(Tracer tracer) {
        return new DecisionTracer(tracer);
    }
}
