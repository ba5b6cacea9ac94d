package com.trusty.directory;

import com.trusty.accesscontrol.Permission;
import com.trusty.accesscontrol.RoleId;
import com.trusty.accesscontrol.ScopedRole;
import java.util.List;

/**
 * A named set of permissions owned by a tenant and evaluated in exactly one namespace.
 *
 * @param roleId      generated identifier
 * @param tenantId    owning tenant
 * @param namespace   namespace the permissions apply to
 * @param name        display name, unique per tenant and namespace
 * @param permissions grant statements in insertion order
 */
public record Role(
        RoleId roleId, String tenantId, String namespace, String name, List<Permission> permissions) {

    public Role {
        if (roleId == null) {
            throw new IllegalArgumentException("roleId must not be null");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    /** The projection the permission matcher works on. */
    public ScopedRole toScopedRole() {
        return new ScopedRole(roleId, namespace, permissions);
    }
}
