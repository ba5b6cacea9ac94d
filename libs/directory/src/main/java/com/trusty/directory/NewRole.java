package com.trusty.directory;

import com.trusty.accesscontrol.Permission;
import java.util.List;

/** Input for {@link DirectoryRepository#createRole(NewRole)}. */
public record NewRole(String tenantId, String namespace, String name, List<Permission> permissions) {

    public NewRole {
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
}
