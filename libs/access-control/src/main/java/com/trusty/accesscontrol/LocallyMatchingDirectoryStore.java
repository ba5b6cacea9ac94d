package com.trusty.accesscontrol;

import java.util.Collection;
import java.util.Set;

/**
 * Base class for stores that load role documents and run {@link PermissionMatcher} in process,
 * instead of pushing the matching grammar down into the storage query.
 *
 * <p>Subclasses only have to fetch the candidate documents; the namespace filter they receive is
 * an optimisation hint, the matcher applies it again.
 */
public abstract class LocallyMatchingDirectoryStore implements DirectoryStore {

    private final PermissionMatcher matcher;

    protected LocallyMatchingDirectoryStore() {
        this(new PermissionMatcher());
    }

    protected LocallyMatchingDirectoryStore(PermissionMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public final Set<RoleId> getRolesMatchingRequest(
            Set<RoleId> roleIds, RequestedAccess access, String namespace) {
        if (roleIds.isEmpty()) {
            return Set.of();
        }
        return matcher.match(roleIds, namespace, access, findRoles(roleIds, namespace));
    }

    /**
     * Loads the role documents for the given ids that are scoped to {@code namespace}.
     *
     * @throws StoreUnavailableException if the store cannot be queried
     */
    protected abstract Collection<ScopedRole> findRoles(Set<RoleId> roleIds, String namespace);
}
