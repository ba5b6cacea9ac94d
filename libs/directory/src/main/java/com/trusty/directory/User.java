package com.trusty.directory;

import com.trusty.accesscontrol.RoleId;
import java.util.Set;

/**
 * A directory user, looked up by decisions through its {@code externalUserId}.
 *
 * @param userId         generated identifier
 * @param externalUserId id issued by the upstream identity provider; unique
 * @param email          contact address, may be null
 * @param name           display name, may be null
 * @param tenantIds      tenants the user belongs to
 * @param roleIds        assigned roles; each belongs to one of {@code tenantIds}
 */
public record User(
        String userId,
        String externalUserId,
        String email,
        String name,
        Set<String> tenantIds,
        Set<RoleId> roleIds) {

    public User {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (externalUserId == null || externalUserId.isBlank()) {
            throw new IllegalArgumentException("externalUserId must not be null or blank");
        }
        tenantIds = tenantIds == null ? Set.of() : Set.copyOf(tenantIds);
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }
}
