package com.trusty.directory;

import com.trusty.accesscontrol.LocallyMatchingDirectoryStore;
import com.trusty.accesscontrol.RoleId;
import com.trusty.accesscontrol.ScopedRole;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local directory used by the {@code test} profile and for demos.
 *
 * <p>Entities are immutable records in concurrent maps, so decisions read without locking. Writes
 * are serialised on the instance; a write that touches several maps (e.g. deleting a role) is not
 * atomic with respect to concurrent readers, which may briefly see the role gone but still assigned.
 * The matcher then simply finds no document for it.
 */
public class InMemoryDirectoryRepository extends LocallyMatchingDirectoryStore
        implements DirectoryRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDirectoryRepository.class);

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<String, User> users = new ConcurrentHashMap<>();
    private final Map<String, String> userIdsByExternalId = new ConcurrentHashMap<>();
    private final Map<RoleId, Role> roles = new ConcurrentHashMap<>();

    // ── DirectoryStore ──

    @Override
    public Set<RoleId> getRoleIdsForUser(String externalUserId) {
        String userId = userIdsByExternalId.get(externalUserId);
        if (userId == null) {
            return Set.of();
        }
        User user = users.get(userId);
        return user == null ? Set.of() : user.roleIds();
    }

    @Override
    protected Collection<ScopedRole> findRoles(Set<RoleId> roleIds, String namespace) {
        return roleIds.stream()
                .map(roles::get)
                .filter(Objects::nonNull)
                .filter(role -> role.namespace().equals(namespace))
                .map(Role::toScopedRole)
                .toList();
    }

    // ── Tenants ──

    @Override
    public synchronized Tenant createTenant(NewTenant tenant) {
        var created = new Tenant(newId(), tenant.name(), Set.of());
        tenants.put(created.tenantId(), created);
        log.info("Created tenant {} ({})", created.tenantId(), created.name());
        return created;
    }

    @Override
    public synchronized Tenant renameTenant(String tenantId, String name) {
        Tenant existing = requireTenant(tenantId);
        var renamed = new Tenant(tenantId, name, existing.products());
        tenants.put(tenantId, renamed);
        return renamed;
    }

    @Override
    public synchronized Tenant subscribeTenant(String tenantId, String product) {
        if (product == null || product.isBlank()) {
            throw new IllegalArgumentException("product must not be null or blank");
        }
        Tenant existing = requireTenant(tenantId);
        Set<String> products = new HashSet<>(existing.products());
        products.add(product);
        var subscribed = new Tenant(tenantId, existing.name(), products);
        tenants.put(tenantId, subscribed);
        return subscribed;
    }

    @Override
    public Optional<Tenant> findTenant(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public List<Tenant> listTenants() {
        return tenants.values().stream().sorted(Comparator.comparing(Tenant::tenantId)).toList();
    }

    @Override
    public synchronized void deleteTenant(String tenantId) {
        requireTenant(tenantId);
        Set<RoleId> owned =
                roles.values().stream()
                        .filter(role -> role.tenantId().equals(tenantId))
                        .map(Role::roleId)
                        .collect(Collectors.toSet());
        for (User user : List.copyOf(users.values())) {
            if (user.tenantIds().contains(tenantId)) {
                Set<String> tenantIds = new HashSet<>(user.tenantIds());
                tenantIds.remove(tenantId);
                Set<RoleId> roleIds = new HashSet<>(user.roleIds());
                roleIds.removeAll(owned);
                users.put(user.userId(), withMembership(user, tenantIds, roleIds));
            }
        }
        owned.forEach(roles::remove);
        tenants.remove(tenantId);
        log.info("Deleted tenant {} and {} role(s)", tenantId, owned.size());
    }

    // ── Users ──

    @Override
    public synchronized User createUser(NewUser user) {
        if (userIdsByExternalId.containsKey(user.externalUserId())) {
            throw new DirectoryConflictException(
                    "external user id '%s' already exists".formatted(user.externalUserId()));
        }
        var created =
                new User(newId(), user.externalUserId(), user.email(), user.name(), Set.of(), Set.of());
        users.put(created.userId(), created);
        userIdsByExternalId.put(created.externalUserId(), created.userId());
        log.info("Created user {} for external id {}", created.userId(), created.externalUserId());
        return created;
    }

    @Override
    public synchronized User updateUser(String userId, UserUpdate update) {
        User existing = requireUser(userId);
        Set<RoleId> roleIds = existing.roleIds();
        if (update.roleIds() != null) {
            for (RoleId roleId : update.roleIds()) {
                Role role = requireRole(roleId);
                if (!existing.tenantIds().contains(role.tenantId())) {
                    throw roleOutsideTenants(existing, role);
                }
            }
            roleIds = update.roleIds();
        }
        var updated =
                new User(
                        userId,
                        existing.externalUserId(),
                        update.email() != null ? update.email() : existing.email(),
                        update.name() != null ? update.name() : existing.name(),
                        existing.tenantIds(),
                        roleIds);
        users.put(userId, updated);
        return updated;
    }

    @Override
    public synchronized User associateUser(String userId, String tenantId) {
        User existing = requireUser(userId);
        requireTenant(tenantId);
        Set<String> tenantIds = new HashSet<>(existing.tenantIds());
        tenantIds.add(tenantId);
        var associated = withMembership(existing, tenantIds, existing.roleIds());
        users.put(userId, associated);
        return associated;
    }

    @Override
    public Optional<User> findUser(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public Optional<User> findUserByExternalId(String externalUserId) {
        return Optional.ofNullable(userIdsByExternalId.get(externalUserId)).map(users::get);
    }

    @Override
    public List<User> listUsers(String tenantId) {
        return users.values().stream()
                .filter(user -> tenantId == null || user.tenantIds().contains(tenantId))
                .sorted(Comparator.comparing(User::userId))
                .toList();
    }

    @Override
    public synchronized void deleteUser(String userId) {
        User removed = requireUser(userId);
        users.remove(userId);
        userIdsByExternalId.remove(removed.externalUserId());
        log.info("Deleted user {}", userId);
    }

    // ── Roles ──

    @Override
    public synchronized Role createRole(NewRole role) {
        requireTenant(role.tenantId());
        requireUniqueName(role.tenantId(), role.namespace(), role.name(), null);
        var created =
                new Role(
                        RoleId.of(newId()),
                        role.tenantId(),
                        role.namespace(),
                        role.name(),
                        role.permissions());
        roles.put(created.roleId(), created);
        log.info(
                "Created role {} ({}) in namespace {} for tenant {}",
                created.roleId(),
                created.name(),
                created.namespace(),
                created.tenantId());
        return created;
    }

    @Override
    public synchronized Role updateRole(RoleId roleId, RoleUpdate update) {
        Role existing = requireRole(roleId);
        String name = update.name() != null ? update.name() : existing.name();
        if (!name.equals(existing.name())) {
            requireUniqueName(existing.tenantId(), existing.namespace(), name, roleId);
        }
        var updated =
                new Role(
                        roleId,
                        existing.tenantId(),
                        existing.namespace(),
                        name,
                        update.permissions() != null ? update.permissions() : existing.permissions());
        roles.put(roleId, updated);
        return updated;
    }

    @Override
    public Optional<Role> findRole(RoleId roleId) {
        return Optional.ofNullable(roles.get(roleId));
    }

    @Override
    public List<Role> listRoles(String tenantId, String namespace) {
        return roles.values().stream()
                .filter(role -> tenantId == null || role.tenantId().equals(tenantId))
                .filter(role -> namespace == null || role.namespace().equals(namespace))
                .sorted(Comparator.comparing(role -> role.roleId().value()))
                .toList();
    }

    @Override
    public synchronized void deleteRole(RoleId roleId) {
        requireRole(roleId);
        for (User user : List.copyOf(users.values())) {
            if (user.roleIds().contains(roleId)) {
                Set<RoleId> roleIds = new HashSet<>(user.roleIds());
                roleIds.remove(roleId);
                users.put(user.userId(), withMembership(user, user.tenantIds(), roleIds));
            }
        }
        roles.remove(roleId);
        log.info("Deleted role {}", roleId);
    }

    @Override
    public void verifyConnectivity() {
        // always reachable
    }

    // ── Private Helpers ──

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static User withMembership(User user, Set<String> tenantIds, Set<RoleId> roleIds) {
        return new User(
                user.userId(), user.externalUserId(), user.email(), user.name(), tenantIds, roleIds);
    }

    private Tenant requireTenant(String tenantId) {
        Tenant tenant = tenantId == null ? null : tenants.get(tenantId);
        if (tenant == null) {
            throw new DirectoryEntityNotFoundException("tenant", tenantId);
        }
        return tenant;
    }

    private User requireUser(String userId) {
        User user = userId == null ? null : users.get(userId);
        if (user == null) {
            throw new DirectoryEntityNotFoundException("user", userId);
        }
        return user;
    }

    private Role requireRole(RoleId roleId) {
        Role role = roleId == null ? null : roles.get(roleId);
        if (role == null) {
            throw new DirectoryEntityNotFoundException("role", String.valueOf(roleId));
        }
        return role;
    }

    private void requireUniqueName(String tenantId, String namespace, String name, RoleId except) {
        boolean taken =
                roles.values().stream()
                        .anyMatch(
                                role ->
                                        role.tenantId().equals(tenantId)
                                                && role.namespace().equals(namespace)
                                                && role.name().equals(name)
                                                && !role.roleId().equals(except));
        if (taken) {
            throw new DirectoryConflictException(
                    "role '%s' already exists in namespace '%s' of tenant '%s'"
                            .formatted(name, namespace, tenantId));
        }
    }

    private static DirectoryConflictException roleOutsideTenants(User user, Role role) {
        return new DirectoryConflictException(
                "role '%s' belongs to tenant '%s', which user '%s' is not a member of"
                        .formatted(role.roleId(), role.tenantId(), user.userId()));
    }
}
