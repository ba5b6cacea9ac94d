package com.trusty.accesscontrol;

import java.util.List;

/**
 * The part of a directory role the matcher needs: its id, the namespace it is scoped to and its
 * permissions. Tenant and display name stay in the directory.
 *
 * @param roleId      role identifier
 * @param namespace   the namespace this role is evaluated in, and only this one
 * @param permissions grant statements, OR'd together; empty means the role grants nothing
 */
public record ScopedRole(RoleId roleId, String namespace, List<Permission> permissions) {

    public ScopedRole {
        if (roleId == null) {
            throw new IllegalArgumentException("roleId must not be null");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
