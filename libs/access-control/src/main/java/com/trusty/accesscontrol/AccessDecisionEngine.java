package com.trusty.accesscontrol;

import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the access-control core: answers whether an actor may perform an action on a
 * resource within a namespace.
 *
 * <p>Every call runs the same linear pipeline:
 *
 * <ol>
 *   <li>validate the request shape ({@link InvalidRequestException}, no store access),
 *   <li>resolve the actor's role ids ({@link RoleResolver}),
 *   <li>match those roles against the request within the namespace ({@link
 *       DirectoryStore#getRolesMatchingRequest}, with {@link PermissionMatcher} semantics),
 *   <li>reduce: allowed iff at least one role matched.
 * </ol>
 *
 * <p>Roles only ever add permissions; there is no deny statement and so no conflict resolution.
 * The engine is stateless and holds no locks, so one instance serves any number of concurrent
 * decisions. It does not retry, cache or default: a store failure surfaces as {@link
 * StoreUnavailableException} and is never reported as a deny.
 */
public final class AccessDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionEngine.class);

    private final RoleResolver roleResolver;
    private final DirectoryStore directoryStore;

    public AccessDecisionEngine(DirectoryStore directoryStore) {
        this(new RoleResolver(directoryStore), directoryStore);
    }

    public AccessDecisionEngine(RoleResolver roleResolver, DirectoryStore directoryStore) {
        if (roleResolver == null) {
            throw new IllegalArgumentException("roleResolver must not be null");
        }
        if (directoryStore == null) {
            throw new IllegalArgumentException("directoryStore must not be null");
        }
        this.roleResolver = roleResolver;
        this.directoryStore = directoryStore;
    }

    /**
     * Decides a request in the namespace it carries.
     *
     * @see #isAllowed(IsAllowedRequest, String)
     */
    public IsAllowedResult isAllowed(IsAllowedRequest request) {
        return isAllowed(request, request == null ? null : request.namespace());
    }

    /**
     * Decides a request within {@code namespace}.
     *
     * @param request   the access question
     * @param namespace namespace the decision is scoped to; must match the request's namespace
     *     when the request carries one
     * @return {@link IsAllowedResult#ALLOWED} if any of the actor's roles in {@code namespace}
     *     grants the action on the resource, otherwise {@link IsAllowedResult#DENIED}
     * @throws InvalidRequestException   if a field is missing or blank; the store is not called
     * @throws StoreUnavailableException if either directory lookup fails
     */
    public IsAllowedResult isAllowed(IsAllowedRequest request, String namespace) {
        ValidationResult validation = IsAllowedRequestValidator.validate(request, namespace);
        if (!validation.valid()) {
            log.debug("Rejected decision request: {}", validation.errors());
            throw new InvalidRequestException(validation.errors());
        }

        Set<RoleId> roleIds = roleResolver.resolve(request.externalUserId());
        if (roleIds.isEmpty()) {
            log.debug(
                    "Denied {} on '{}' in namespace '{}': user '{}' has no roles",
                    request.action(),
                    request.resource(),
                    namespace,
                    request.externalUserId());
            return IsAllowedResult.DENIED;
        }

        Set<RoleId> matchingRoles = matchRoles(roleIds, RequestedAccess.of(request), namespace);
        IsAllowedResult result = IsAllowedResult.of(!matchingRoles.isEmpty());
        log.debug(
                "{} {} on '{}' in namespace '{}' for user '{}' ({} of {} role(s) matched)",
                result.result() ? "Allowed" : "Denied",
                request.action(),
                request.resource(),
                namespace,
                request.externalUserId(),
                matchingRoles.size(),
                roleIds.size());
        return result;
    }

    private Set<RoleId> matchRoles(Set<RoleId> roleIds, RequestedAccess access, String namespace) {
        Set<RoleId> matching;
        try {
            matching = directoryStore.getRolesMatchingRequest(roleIds, access, namespace);
        } catch (StoreUnavailableException e) {
            log.warn("Role matching failed in namespace '{}': {}", namespace, e.getMessage());
            throw e;
        }
        if (matching == null) {
            throw new StoreUnavailableException("Directory store returned no matching-role set");
        }
        return matching;
    }
}
