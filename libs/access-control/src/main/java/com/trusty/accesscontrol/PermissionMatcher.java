package com.trusty.accesscontrol;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which of an actor's roles grant a requested action on a resource within a namespace.
 *
 * <p>Per role, in order:
 *
 * <ol>
 *   <li>discard it if it is not one of the requested role ids,
 *   <li>discard it if its namespace differs from the request's namespace,
 *   <li>discard it if it has no permissions,
 *   <li>keep it if <em>any</em> permission matches both the action and the resource.
 * </ol>
 *
 * <p>Action match: the permission's action is {@value Permission#ANY_ACTION} or equals the
 * requested action exactly. Case is never folded. Resource match: see {@link ResourcePattern}.
 *
 * <p>WHY stateless: the matcher is shared by every directory store that matches role documents
 * locally and by every concurrent decision. It holds no fields, so it needs no synchronisation.
 */
public final class PermissionMatcher {

    /**
     * Returns the subset of {@code roleIds} whose role grants the request.
     *
     * @param roleIds    the actor's role ids, as resolved by {@link RoleResolver}
     * @param namespace  the request namespace; roles from other namespaces never match
     * @param access     the requested action and resource
     * @param candidates role documents loaded by the store; documents not in {@code roleIds} are
     *     ignored
     * @return the matching role ids, possibly empty, never null
     */
    public Set<RoleId> match(
            Set<RoleId> roleIds,
            String namespace,
            RequestedAccess access,
            Collection<ScopedRole> candidates) {
        if (roleIds.isEmpty() || candidates.isEmpty()) {
            return Set.of();
        }
        Set<RoleId> matched = new LinkedHashSet<>();
        for (ScopedRole role : candidates) {
            if (roleIds.contains(role.roleId()) && grants(role, namespace, access)) {
                matched.add(role.roleId());
            }
        }
        return Set.copyOf(matched);
    }

    /**
     * Checks a single role against a request.
     *
     * @return true if the role is scoped to {@code namespace} and at least one of its permissions
     *     matches the action and resource
     */
    public boolean grants(ScopedRole role, String namespace, RequestedAccess access) {
        if (!role.namespace().equals(namespace)) {
            return false;
        }
        if (role.permissions().isEmpty()) {
            return false;
        }
        for (Permission permission : role.permissions()) {
            if (grants(permission, access)) {
                return true;
            }
        }
        return false;
    }

    /** Checks a single permission against a requested action and resource. */
    public boolean grants(Permission permission, RequestedAccess access) {
        return actionMatches(permission.action(), access.action())
                && permission.resourcePattern().matches(access.resource());
    }

    static boolean actionMatches(String granted, String requested) {
        return Permission.ANY_ACTION.equals(granted) || granted.equals(requested);
    }
}
