package com.trusty.directory;

import java.util.Set;

/**
 * An organisation that owns roles and that users belong to.
 *
 * @param tenantId generated identifier
 * @param name     display name
 * @param products products the tenant is subscribed to
 */
public record Tenant(String tenantId, String name, Set<String> products) {

    public Tenant {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        products = products == null ? Set.of() : Set.copyOf(products);
    }
}
