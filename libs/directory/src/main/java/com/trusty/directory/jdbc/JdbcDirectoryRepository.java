package com.trusty.directory.jdbc;

import com.trusty.accesscontrol.LocallyMatchingDirectoryStore;
import com.trusty.accesscontrol.Permission;
import com.trusty.accesscontrol.RoleId;
import com.trusty.accesscontrol.ScopedRole;
import com.trusty.accesscontrol.StoreUnavailableException;
import com.trusty.directory.DirectoryConflictException;
import com.trusty.directory.DirectoryEntityNotFoundException;
import com.trusty.directory.DirectoryRepository;
import com.trusty.directory.NewRole;
import com.trusty.directory.NewTenant;
import com.trusty.directory.NewUser;
import com.trusty.directory.Role;
import com.trusty.directory.RoleUpdate;
import com.trusty.directory.Tenant;
import com.trusty.directory.User;
import com.trusty.directory.UserUpdate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL-backed directory. Schema: {@code db/migration/directory}.
 *
 * <p>Role resolution is a single join on {@code user_roles}; matching loads the namespace-filtered
 * role documents with their permissions and runs the shared matcher in process.
 *
 * <p>WHY errors are translated here: the engine and the REST layer only know the directory's own
 * exceptions. Any {@link DataAccessException} or {@link TransactionException} becomes {@link
 * StoreUnavailableException}, except unique-key violations, which are rule violations and become
 * {@link DirectoryConflictException}.
 */
public class JdbcDirectoryRepository extends LocallyMatchingDirectoryStore
        implements DirectoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDirectoryRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcDirectoryRepository(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    // ── DirectoryStore ──

    @Override
    public Set<RoleId> getRoleIdsForUser(String externalUserId) {
        return access(
                "resolve roles",
                () ->
                        jdbc.queryForList(
                                        """
                                        SELECT ur.role_id
                                          FROM user_roles ur
                                          JOIN users u ON u.user_id = ur.user_id
                                         WHERE u.external_user_id = :externalUserId
                                        """,
                                        Map.of("externalUserId", externalUserId),
                                        String.class)
                                .stream()
                                .map(id -> decoded(() -> RoleId.of(id)))
                                .collect(Collectors.toSet()));
    }

    @Override
    protected Collection<ScopedRole> findRoles(Set<RoleId> roleIds, String namespace) {
        var params =
                new MapSqlParameterSource()
                        .addValue("namespace", namespace)
                        .addValue("roleIds", ids(roleIds));
        Map<RoleId, List<Permission>> permissions = new LinkedHashMap<>();
        access(
                "load roles",
                () -> {
                    jdbc.query(
                            """
                            SELECT r.role_id, p.action, p.resource
                              FROM roles r
                              LEFT JOIN role_permissions p ON p.role_id = r.role_id
                             WHERE r.namespace = :namespace
                               AND r.role_id IN (:roleIds)
                             ORDER BY r.role_id, p.ordinal
                            """,
                            params,
                            storedRows(rs -> {
                                var perms =
                                        permissions.computeIfAbsent(
                                                RoleId.of(rs.getString("role_id")),
                                                id -> new ArrayList<>());
                                String action = rs.getString("action");
                                if (action != null) {
                                    perms.add(Permission.of(action, rs.getString("resource")));
                                }
                            }));
                    return null;
                });
        return permissions.entrySet().stream()
                .map(e -> new ScopedRole(e.getKey(), namespace, e.getValue()))
                .toList();
    }

    // ── Tenants ──

    @Override
    public Tenant createTenant(NewTenant tenant) {
        String tenantId = newId();
        access(
                "create tenant",
                () ->
                        jdbc.update(
                                "INSERT INTO tenants (tenant_id, name) VALUES (:tenantId, :name)",
                                Map.of("tenantId", tenantId, "name", tenant.name())));
        log.info("Created tenant {} ({})", tenantId, tenant.name());
        return new Tenant(tenantId, tenant.name(), Set.of());
    }

    @Override
    public Tenant renameTenant(String tenantId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        return inTransaction(
                "rename tenant",
                () -> {
                    int updated =
                            jdbc.update(
                                    "UPDATE tenants SET name = :name WHERE tenant_id = :tenantId",
                                    Map.of("tenantId", tenantId, "name", name));
                    if (updated == 0) {
                        throw new DirectoryEntityNotFoundException("tenant", tenantId);
                    }
                    return requireTenant(tenantId);
                });
    }

    @Override
    public Tenant subscribeTenant(String tenantId, String product) {
        if (product == null || product.isBlank()) {
            throw new IllegalArgumentException("product must not be null or blank");
        }
        return inTransaction(
                "subscribe tenant",
                () -> {
                    requireTenant(tenantId);
                    jdbc.update(
                            """
                            INSERT INTO tenant_products (tenant_id, product)
                            VALUES (:tenantId, :product)
                            ON CONFLICT DO NOTHING
                            """,
                            Map.of("tenantId", tenantId, "product", product));
                    return requireTenant(tenantId);
                });
    }

    @Override
    public Optional<Tenant> findTenant(String tenantId) {
        return access("find tenant", () -> loadTenants(tenantId).stream().findFirst());
    }

    @Override
    public List<Tenant> listTenants() {
        return access("list tenants", () -> loadTenants(null));
    }

    @Override
    public void deleteTenant(String tenantId) {
        int deleted =
                access(
                        "delete tenant",
                        () ->
                                jdbc.update(
                                        "DELETE FROM tenants WHERE tenant_id = :tenantId",
                                        Map.of("tenantId", tenantId)));
        if (deleted == 0) {
            throw new DirectoryEntityNotFoundException("tenant", tenantId);
        }
        log.info("Deleted tenant {}", tenantId);
    }

    // ── Users ──

    @Override
    public User createUser(NewUser user) {
        String userId = newId();
        var params =
                new MapSqlParameterSource()
                        .addValue("userId", userId)
                        .addValue("externalUserId", user.externalUserId())
                        .addValue("email", user.email())
                        .addValue("name", user.name());
        try {
            access(
                    "create user",
                    () ->
                            jdbc.update(
                                    """
                                    INSERT INTO users (user_id, external_user_id, email, name)
                                    VALUES (:userId, :externalUserId, :email, :name)
                                    """,
                                    params));
        } catch (DirectoryConflictException e) {
            throw new DirectoryConflictException(
                    "external user id '%s' already exists".formatted(user.externalUserId()), e);
        }
        log.info("Created user {} for external id {}", userId, user.externalUserId());
        return new User(userId, user.externalUserId(), user.email(), user.name(), Set.of(), Set.of());
    }

    @Override
    public User updateUser(String userId, UserUpdate update) {
        return inTransaction(
                "update user",
                () -> {
                    User existing = requireUser(userId);
                    var params =
                            new MapSqlParameterSource()
                                    .addValue("userId", userId)
                                    .addValue(
                                            "email",
                                            update.email() != null
                                                    ? update.email()
                                                    : existing.email())
                                    .addValue(
                                            "name",
                                            update.name() != null ? update.name() : existing.name());
                    jdbc.update(
                            "UPDATE users SET email = :email, name = :name WHERE user_id = :userId",
                            params);
                    if (update.roleIds() != null) {
                        replaceRoles(existing, update.roleIds());
                    }
                    return requireUser(userId);
                });
    }

    @Override
    public User associateUser(String userId, String tenantId) {
        return inTransaction(
                "associate user",
                () -> {
                    requireUser(userId);
                    requireTenant(tenantId);
                    jdbc.update(
                            """
                            INSERT INTO user_tenants (user_id, tenant_id)
                            VALUES (:userId, :tenantId)
                            ON CONFLICT DO NOTHING
                            """,
                            Map.of("userId", userId, "tenantId", tenantId));
                    return requireUser(userId);
                });
    }

    @Override
    public Optional<User> findUser(String userId) {
        return access(
                "find user",
                () ->
                        loadUsers("WHERE u.user_id = :userId", Map.of("userId", userId)).stream()
                                .findFirst());
    }

    @Override
    public Optional<User> findUserByExternalId(String externalUserId) {
        return access(
                "find user",
                () ->
                        loadUsers(
                                        "WHERE u.external_user_id = :externalUserId",
                                        Map.of("externalUserId", externalUserId))
                                .stream()
                                .findFirst());
    }

    @Override
    public List<User> listUsers(String tenantId) {
        if (tenantId == null) {
            return access("list users", () -> loadUsers("", Map.of()));
        }
        return access(
                "list users",
                () ->
                        loadUsers(
                                """
                                WHERE u.user_id IN (SELECT ut.user_id FROM user_tenants ut
                                                     WHERE ut.tenant_id = :tenantId)
                                """,
                                Map.of("tenantId", tenantId)));
    }

    @Override
    public void deleteUser(String userId) {
        int deleted =
                access(
                        "delete user",
                        () ->
                                jdbc.update(
                                        "DELETE FROM users WHERE user_id = :userId",
                                        Map.of("userId", userId)));
        if (deleted == 0) {
            throw new DirectoryEntityNotFoundException("user", userId);
        }
        log.info("Deleted user {}", userId);
    }

    // ── Roles ──

    @Override
    public Role createRole(NewRole role) {
        RoleId roleId = RoleId.of(newId());
        try {
            inTransaction(
                    "create role",
                    () -> {
                        requireTenant(role.tenantId());
                        jdbc.update(
                                """
                                INSERT INTO roles (role_id, tenant_id, namespace, name)
                                VALUES (:roleId, :tenantId, :namespace, :name)
                                """,
                                Map.of(
                                        "roleId", roleId.value(),
                                        "tenantId", role.tenantId(),
                                        "namespace", role.namespace(),
                                        "name", role.name()));
                        insertPermissions(roleId, role.permissions());
                        return null;
                    });
        } catch (DirectoryConflictException e) {
            throw duplicateRoleName(role.tenantId(), role.namespace(), role.name(), e);
        }
        log.info(
                "Created role {} ({}) in namespace {} for tenant {}",
                roleId,
                role.name(),
                role.namespace(),
                role.tenantId());
        return new Role(roleId, role.tenantId(), role.namespace(), role.name(), role.permissions());
    }

    @Override
    public Role updateRole(RoleId roleId, RoleUpdate update) {
        try {
            return inTransaction(
                    "update role",
                    () -> {
                        requireRole(roleId);
                        if (update.name() != null) {
                            jdbc.update(
                                    "UPDATE roles SET name = :name WHERE role_id = :roleId",
                                    Map.of("roleId", roleId.value(), "name", update.name()));
                        }
                        if (update.permissions() != null) {
                            jdbc.update(
                                    "DELETE FROM role_permissions WHERE role_id = :roleId",
                                    Map.of("roleId", roleId.value()));
                            insertPermissions(roleId, update.permissions());
                        }
                        return requireRole(roleId);
                    });
        } catch (DirectoryConflictException e) {
            throw new DirectoryConflictException(
                    "role name '%s' is already taken".formatted(update.name()), e);
        }
    }

    @Override
    public Optional<Role> findRole(RoleId roleId) {
        return access(
                "find role",
                () ->
                        loadRoles("WHERE r.role_id = :roleId", Map.of("roleId", roleId.value()))
                                .stream()
                                .findFirst());
    }

    @Override
    public List<Role> listRoles(String tenantId, String namespace) {
        List<String> filters = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (tenantId != null) {
            filters.add("r.tenant_id = :tenantId");
            params.put("tenantId", tenantId);
        }
        if (namespace != null) {
            filters.add("r.namespace = :namespace");
            params.put("namespace", namespace);
        }
        String where = filters.isEmpty() ? "" : "WHERE " + String.join(" AND ", filters);
        return access("list roles", () -> loadRoles(where, params));
    }

    @Override
    public void deleteRole(RoleId roleId) {
        int deleted =
                access(
                        "delete role",
                        () ->
                                jdbc.update(
                                        "DELETE FROM roles WHERE role_id = :roleId",
                                        Map.of("roleId", roleId.value())));
        if (deleted == 0) {
            throw new DirectoryEntityNotFoundException("role", roleId.value());
        }
        log.info("Deleted role {}", roleId);
    }

    @Override
    public void verifyConnectivity() {
        access(
                "verify connectivity",
                () -> jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class));
    }

    // ── Private Helpers ──

    private <T> T access(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DuplicateKeyException e) {
            throw new DirectoryConflictException(operation + " violates a uniqueness rule", e);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Directory store failed to {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("directory store failed to " + operation, e);
        }
    }

    /** Rows that fail the model's own checks are a directory fault, not a caller error. */
    private static RowCallbackHandler storedRows(RowCallbackHandler handler) {
        return rs -> {
            try {
                handler.processRow(rs);
            } catch (IllegalArgumentException e) {
                throw invalidData(e);
            }
        };
    }

    private static <T> T decoded(Supplier<T> build) {
        try {
            return build.get();
        } catch (IllegalArgumentException e) {
            throw invalidData(e);
        }
    }

    private static StoreUnavailableException invalidData(IllegalArgumentException e) {
        log.error("Directory store returned invalid data: {}", e.getMessage());
        return new StoreUnavailableException("directory store returned invalid data", e);
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        return access(operation, () -> tx.execute(status -> work.get()));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static List<String> ids(Set<RoleId> roleIds) {
        return roleIds.stream().map(RoleId::value).toList();
    }

    private void replaceRoles(User user, Set<RoleId> roleIds) {
        if (!roleIds.isEmpty()) {
            Map<String, String> tenantByRole = new HashMap<>();
            jdbc.query(
                    "SELECT role_id, tenant_id FROM roles WHERE role_id IN (:roleIds)",
                    Map.of("roleIds", ids(roleIds)),
                    rs -> {
                        tenantByRole.put(rs.getString("role_id"), rs.getString("tenant_id"));
                    });
            for (RoleId roleId : roleIds) {
                String tenantId = tenantByRole.get(roleId.value());
                if (tenantId == null) {
                    throw new DirectoryEntityNotFoundException("role", roleId.value());
                }
                if (!user.tenantIds().contains(tenantId)) {
                    throw new DirectoryConflictException(
                            "role '%s' belongs to tenant '%s', which user '%s' is not a member of"
                                    .formatted(roleId, tenantId, user.userId()));
                }
            }
        }
        jdbc.update("DELETE FROM user_roles WHERE user_id = :userId", Map.of("userId", user.userId()));
        for (RoleId roleId : roleIds) {
            jdbc.update(
                    "INSERT INTO user_roles (user_id, role_id) VALUES (:userId, :roleId)",
                    Map.of("userId", user.userId(), "roleId", roleId.value()));
        }
    }

    private void insertPermissions(RoleId roleId, List<Permission> permissions) {
        for (int i = 0; i < permissions.size(); i++) {
            Permission permission = permissions.get(i);
            jdbc.update(
                    """
                    INSERT INTO role_permissions (role_id, ordinal, action, resource)
                    VALUES (:roleId, :ordinal, :action, :resource)
                    """,
                    Map.of(
                            "roleId", roleId.value(),
                            "ordinal", i,
                            "action", permission.action(),
                            "resource", permission.resource()));
        }
    }

    private Tenant requireTenant(String tenantId) {
        return loadTenants(tenantId).stream()
                .findFirst()
                .orElseThrow(() -> new DirectoryEntityNotFoundException("tenant", tenantId));
    }

    private User requireUser(String userId) {
        return loadUsers("WHERE u.user_id = :userId", Map.of("userId", userId)).stream()
                .findFirst()
                .orElseThrow(() -> new DirectoryEntityNotFoundException("user", userId));
    }

    private Role requireRole(RoleId roleId) {
        return loadRoles("WHERE r.role_id = :roleId", Map.of("roleId", roleId.value())).stream()
                .findFirst()
                .orElseThrow(() -> new DirectoryEntityNotFoundException("role", roleId.value()));
    }

    private List<Tenant> loadTenants(String tenantId) {
        String where = tenantId == null ? "" : "WHERE t.tenant_id = :tenantId";
        Map<String, Object> params = tenantId == null ? Map.of() : Map.of("tenantId", tenantId);
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, Set<String>> products = new HashMap<>();
        jdbc.query(
                """
                SELECT t.tenant_id, t.name, p.product
                  FROM tenants t
                  LEFT JOIN tenant_products p ON p.tenant_id = t.tenant_id
                """
                        + where
                        + " ORDER BY t.tenant_id",
                params,
                storedRows(rs -> {
                    String id = rs.getString("tenant_id");
                    names.put(id, rs.getString("name"));
                    var set = products.computeIfAbsent(id, key -> new HashSet<>());
                    String product = rs.getString("product");
                    if (product != null) {
                        set.add(product);
                    }
                }));
        return decoded(
                () ->
                        names.entrySet().stream()
                                .map(
                                        e ->
                                                new Tenant(
                                                        e.getKey(),
                                                        e.getValue(),
                                                        products.get(e.getKey())))
                                .toList());
    }

    private List<User> loadUsers(String where, Map<String, ?> params) {
        Map<String, User> rows = new LinkedHashMap<>();
        jdbc.query(
                "SELECT u.user_id, u.external_user_id, u.email, u.name FROM users u "
                        + where
                        + " ORDER BY u.user_id",
                params,
                storedRows(rs -> {
                    String id = rs.getString("user_id");
                    rows.put(
                            id,
                            new User(
                                    id,
                                    rs.getString("external_user_id"),
                                    rs.getString("email"),
                                    rs.getString("name"),
                                    Set.of(),
                                    Set.of()));
                }));
        if (rows.isEmpty()) {
            return List.of();
        }
        var ids = Map.of("userIds", List.copyOf(rows.keySet()));
        Map<String, Set<String>> tenants = new HashMap<>();
        jdbc.query(
                "SELECT user_id, tenant_id FROM user_tenants WHERE user_id IN (:userIds)",
                ids,
                rs -> {
                    tenants.computeIfAbsent(rs.getString("user_id"), key -> new HashSet<>())
                            .add(rs.getString("tenant_id"));
                });
        Map<String, Set<RoleId>> roles = new HashMap<>();
        jdbc.query(
                "SELECT user_id, role_id FROM user_roles WHERE user_id IN (:userIds)",
                ids,
                storedRows(rs -> {
                    roles.computeIfAbsent(rs.getString("user_id"), key -> new HashSet<>())
                            .add(RoleId.of(rs.getString("role_id")));
                }));
        return decoded(
                () ->
                        rows.values().stream()
                                .map(
                                        u ->
                                                new User(
                                                        u.userId(),
                                                        u.externalUserId(),
                                                        u.email(),
                                                        u.name(),
                                                        tenants.get(u.userId()),
                                                        roles.get(u.userId())))
                                .toList());
    }

    private List<Role> loadRoles(String where, Map<String, ?> params) {
        Map<String, Role> rows = new LinkedHashMap<>();
        Map<String, List<Permission>> permissions = new HashMap<>();
        jdbc.query(
                """
                SELECT r.role_id, r.tenant_id, r.namespace, r.name, p.action, p.resource
                  FROM roles r
                  LEFT JOIN role_permissions p ON p.role_id = r.role_id
                """
                        + where
                        + " ORDER BY r.role_id, p.ordinal",
                params,
                storedRows(rs -> {
                    String id = rs.getString("role_id");
                    if (!rows.containsKey(id)) {
                        rows.put(
                                id,
                                new Role(
                                        RoleId.of(id),
                                        rs.getString("tenant_id"),
                                        rs.getString("namespace"),
                                        rs.getString("name"),
                                        List.of()));
                    }
                    var perms = permissions.computeIfAbsent(id, key -> new ArrayList<>());
                    String action = rs.getString("action");
                    if (action != null) {
                        perms.add(Permission.of(action, rs.getString("resource")));
                    }
                }));
        return decoded(
                () ->
                        rows.values().stream()
                                .map(
                                        r ->
                                                new Role(
                                                        r.roleId(),
                                                        r.tenantId(),
                                                        r.namespace(),
                                                        r.name(),
                                                        permissions.get(r.roleId().value())))
                                .toList());
    }

    private static DirectoryConflictException duplicateRoleName(
            String tenantId, String namespace, String name, Throwable cause) {
        return new DirectoryConflictException(
                "role '%s' already exists in namespace '%s' of tenant '%s'"
                        .formatted(name, namespace, tenantId),
                cause);
    }
}
