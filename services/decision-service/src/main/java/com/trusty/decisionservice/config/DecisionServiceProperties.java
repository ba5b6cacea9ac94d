package com.trusty.decisionservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code trusty.service.*}.
 *
 * <pre>
 * trusty:
 *   service:
 *     name: decision-service
 *     environment: production
 *     description: Access-control decision service
 * </pre>
 *
 * @param name        used as the {@code service} tag on metrics and as the tracer name. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description
 */
@ConfigurationProperties(prefix = "trusty.service")
@Validated
public record DecisionServiceProperties(
        @NotBlank String name, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public DecisionServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
