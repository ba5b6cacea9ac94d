package com.trusty.accesscontrol;

import java.util.Set;

/**
 * Read side of the directory as seen by the decision engine. The engine never writes through this
 * interface.
 *
 * <p>Both calls may block on I/O. Implementations must be safe to call from many threads at once;
 * the engine adds no synchronisation of its own.
 */
public interface DirectoryStore {

    /**
     * Returns the ids of every role assigned to the user, across all tenants the user belongs to.
     *
     * @param externalUserId the actor's external id
     * @return the role ids; empty (not an error) when the user has no roles or does not exist
     * @throws StoreUnavailableException if the store cannot be queried
     */
    Set<RoleId> getRoleIdsForUser(String externalUserId);

    /**
     * Returns the subset of {@code roleIds} whose roles grant {@code access} within {@code
     * namespace}, with exactly the semantics of {@link PermissionMatcher}. Whether matching runs
     * inside the store or locally is up to the implementation.
     *
     * @throws StoreUnavailableException if the store cannot be queried
     */
    Set<RoleId> getRolesMatchingRequest(
            Set<RoleId> roleIds, RequestedAccess access, String namespace);
}
