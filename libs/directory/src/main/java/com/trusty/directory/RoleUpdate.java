package com.trusty.directory;

import com.trusty.accesscontrol.Permission;
import java.util.List;

/**
 * Partial update of a role. A null field leaves the stored value unchanged; a non-null
 * {@code permissions} replaces the whole list.
 */
public record RoleUpdate(String name, List<Permission> permissions) {

    public RoleUpdate {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        permissions = permissions == null ? null : List.copyOf(permissions);
    }
}
