package com.trusty.decisionservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trusty.directory.NewRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record CreateRoleRequest(
        @JsonProperty("tenant_id") @NotBlank String tenantId,
        @NotBlank String namespace,
        @NotBlank String name,
        List<@Valid PermissionDto> permissions) {

    public NewRole toNewRole() {
        return new NewRole(
                tenantId,
                namespace,
                name,
                permissions == null
                        ? List.of()
                        : permissions.stream().map(PermissionDto::toPermission).toList());
    }
}
