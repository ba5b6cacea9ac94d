package com.trusty.decisionservice.infrastructure.health;

import com.trusty.accesscontrol.StoreUnavailableException;
import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.config.DirectoryProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the directory store as {@code directoryStore} under {@code /actuator/health}. DOWN means
 * every decision will currently fail with 503.
 */
@Component
public class DirectoryStoreHealthIndicator implements HealthIndicator {

    private final DirectoryRepository directory;
    private final DirectoryProperties properties;

    public DirectoryStoreHealthIndicator(
            DirectoryRepository directory, DirectoryProperties properties) {
        this.directory = directory;
        this.properties = properties;
    }

    @Override
    public Health health() {
        String storeType = properties.storeType().name().toLowerCase().replace('_', '-');
        try {
            directory.verifyConnectivity();
            return Health.up().withDetail("storeType", storeType).build();
        } catch (StoreUnavailableException e) {
            return Health.down(e).withDetail("storeType", storeType).build();
        }
    }
}
