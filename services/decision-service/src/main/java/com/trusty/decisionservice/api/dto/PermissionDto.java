package com.trusty.decisionservice.api.dto;

import com.trusty.accesscontrol.Permission;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One grant statement on the wire. The resource grammar is checked by {@link Permission} itself;
 * an invalid pattern surfaces as {@link IllegalArgumentException} and a {@code 400}.
 */
public record PermissionDto(@NotBlank String action, @NotNull String resource) {

    public Permission toPermission() {
        return Permission.of(action, resource);
    }

    public static PermissionDto from(Permission permission) {
        return new PermissionDto(permission.action(), permission.resource());
    }
}
