package com.trusty.directory;

import com.trusty.accesscontrol.RoleId;
import java.util.Set;

/**
 * Partial update of a user. A null field leaves the stored value unchanged; a non-null
 * {@code roleIds} replaces the whole assignment.
 */
public record UserUpdate(String email, String name, Set<RoleId> roleIds) {

    public UserUpdate {
        roleIds = roleIds == null ? null : Set.copyOf(roleIds);
    }
}
