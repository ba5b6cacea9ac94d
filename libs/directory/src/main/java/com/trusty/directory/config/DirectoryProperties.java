package com.trusty.directory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Selects and configures the directory store behind the decision engine.
 *
 * <pre>{@code
 * trusty:
 *   directory:
 *     store-type: jdbc
 *     jdbc:
 *       url: jdbc:postgresql://localhost:5432/trusty
 *       username: trusty
 *       password: trusty_dev_password
 *       locations: classpath:db/migration/directory
 *       migrate-on-startup: true
 * }</pre>
 *
 * @param storeType which store to build
 * @param jdbc      connection settings, required when {@code storeType} is {@code jdbc}
 */
@Validated
@ConfigurationProperties(prefix = "trusty.directory")
public record DirectoryProperties(
        @NotNull @DefaultValue("jdbc") StoreType storeType, @Valid Jdbc jdbc) {

    /** Migration location used when none is configured. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/directory";

    public enum StoreType {
        /** PostgreSQL through JDBC, schema managed by Flyway. */
        JDBC,
        /** Process-local maps; nothing survives a restart. */
        IN_MEMORY
    }

    /**
     * @param url              JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/trusty})
     * @param username         database username
     * @param password         database password
     * @param locations        Flyway migration locations
     * @param migrateOnStartup whether to apply pending migrations when the store is created
     */
    public record Jdbc(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            String locations,
            @DefaultValue("true") boolean migrateOnStartup) {

        public Jdbc {
            if (locations == null || locations.isBlank()) {
                locations = DEFAULT_LOCATIONS;
            }
        }
    }
}
