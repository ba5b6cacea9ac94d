package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.directory.Tenant;
import java.util.List;

public record TenantResponse(
        @JsonProperty("tenant_id") String tenantId, String name, List<String> products) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(
                tenant.tenantId(), tenant.name(), tenant.products().stream().sorted().toList());
    }
}
