package com.trusty.decisionservice.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /v1/tenants} and {@code PATCH /v1/tenants/{tenantId}}. */
public record TenantRequest(@NotBlank String name) {}
