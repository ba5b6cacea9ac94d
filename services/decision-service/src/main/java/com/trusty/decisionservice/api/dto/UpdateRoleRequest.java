package com.trusty.decisionservice.api.dto;

import com.trusty.directory.RoleUpdate;
import jakarta.validation.Valid;
import java.util.List;

/**
 * Body of {@code PATCH /v1/roles/{roleId}}. Omitted fields stay unchanged; {@code permissions},
 * when present, replaces the whole list.
 */
public record UpdateRoleRequest(String name, List<@Valid PermissionDto> permissions) {

    public RoleUpdate toUpdate() {
        return new RoleUpdate(
                name,
                permissions == null
                        ? null
                        : permissions.stream().map(PermissionDto::toPermission).toList());
    }
}
