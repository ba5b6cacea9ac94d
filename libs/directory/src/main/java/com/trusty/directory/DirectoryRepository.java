package com.trusty.directory;

import com.trusty.accesscontrol.DirectoryStore;
import com.trusty.accesscontrol.RoleId;
import com.trusty.accesscontrol.StoreUnavailableException;
import java.util.List;
import java.util.Optional;

/**
 * Full directory: the read side the decision engine uses plus the administrative writes that
 * maintain tenants, users and roles.
 *
 * <p>Rules every implementation enforces:
 *
 * <ul>
 *   <li>ids are generated UUID strings,
 *   <li>external user ids are unique,
 *   <li>role names are unique per tenant and namespace,
 *   <li>a role's tenant must exist, and a user may only hold roles of tenants it belongs to,
 *   <li>deleting a tenant deletes its roles; deleting a role removes it from every user.
 * </ul>
 *
 * <p>Writes are visible to the next {@link #getRoleIdsForUser} / {@link #getRolesMatchingRequest}
 * call; nothing is cached.
 *
 * <p>Operations throw {@link DirectoryEntityNotFoundException} for unknown ids, {@link
 * DirectoryConflictException} for rule violations and {@link StoreUnavailableException} when the
 * backing store cannot be reached.
 */
public interface DirectoryRepository extends DirectoryStore {

    // ── Tenants ──

    Tenant createTenant(NewTenant tenant);

    Tenant renameTenant(String tenantId, String name);

    /** Adds a product subscription; subscribing twice is a no-op. */
    Tenant subscribeTenant(String tenantId, String product);

    Optional<Tenant> findTenant(String tenantId);

    List<Tenant> listTenants();

    /** Deletes the tenant, its roles, and its memberships. Users themselves are kept. */
    void deleteTenant(String tenantId);

    // ── Users ──

    User createUser(NewUser user);

    User updateUser(String userId, UserUpdate update);

    /** Makes the user a member of the tenant; associating twice is a no-op. */
    User associateUser(String userId, String tenantId);

    Optional<User> findUser(String userId);

    Optional<User> findUserByExternalId(String externalUserId);

    /**
     * @param tenantId only members of this tenant, or every user when null
     */
    List<User> listUsers(String tenantId);

    void deleteUser(String userId);

    // ── Roles ──

    Role createRole(NewRole role);

    Role updateRole(RoleId roleId, RoleUpdate update);

    Optional<Role> findRole(RoleId roleId);

    /**
     * @param tenantId  only roles of this tenant, or all tenants when null
     * @param namespace only roles scoped to this namespace, or all namespaces when null
     */
    List<Role> listRoles(String tenantId, String namespace);

    void deleteRole(RoleId roleId);

    /**
     * Checks that the backing store answers.
     *
     * @throws StoreUnavailableException if it does not
     */
    void verifyConnectivity();
}
