package com.trusty.accesscontrol;

import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the role ids assigned to an actor, independent of namespace. Namespace filtering
 * happens later, in {@link PermissionMatcher}.
 */
public class RoleResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

    private final DirectoryStore directoryStore;

    public RoleResolver(DirectoryStore directoryStore) {
        if (directoryStore == null) {
            throw new IllegalArgumentException("directoryStore must not be null");
        }
        this.directoryStore = directoryStore;
    }

    /**
     * Returns the deduplicated role ids of the user; empty for unknown users.
     *
     * @throws StoreUnavailableException if the store fails; never reported as an empty set
     */
    public Set<RoleId> resolve(String externalUserId) {
        Set<RoleId> roleIds;
        try {
            roleIds = directoryStore.getRoleIdsForUser(externalUserId);
        } catch (StoreUnavailableException e) {
            log.warn("Role lookup failed for user '{}': {}", externalUserId, e.getMessage());
            throw e;
        }
        if (roleIds == null) {
            throw new StoreUnavailableException(
                    "Directory store returned no role set for user '%s'".formatted(externalUserId));
        }
        log.debug("Resolved {} role(s) for user '{}'", roleIds.size(), externalUserId);
        return Set.copyOf(roleIds);
    }
}
