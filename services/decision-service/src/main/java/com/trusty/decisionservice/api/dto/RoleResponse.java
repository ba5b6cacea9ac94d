package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.directory.Role;
import java.util.List;

public record RoleResponse(
        @JsonProperty("role_id") String roleId,
        @JsonProperty("tenant_id") String tenantId,
        String namespace,
        String name,
        List<PermissionDto> permissions) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.roleId().value(),
                role.tenantId(),
                role.namespace(),
                role.name(),
                role.permissions().stream().map(PermissionDto::from).toList());
    }
}
