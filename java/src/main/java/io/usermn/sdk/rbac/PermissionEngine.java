package io.usermn.sdk.rbac;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Resolves effective permissions from roles and answers access checks.
 *
 * <p>Role closures are pure functions of the hierarchy, so the permission set for each distinct role combination
 * is computed once and memoised under the sorted list of role names. {@link #reload(RoleHierarchy)} swaps the
 * hierarchy together with a fresh cache; a lookup racing with a reload sees either the old pair or the new one,
 * never a mix.</p>
 *
 * <p>Instances are thread-safe.</p>
 */
public final class PermissionEngine {

    private static final Logger LOGGER = Logger.getLogger(PermissionEngine.class.getName());

    private volatile Snapshot snapshot;

    public PermissionEngine(RoleHierarchy hierarchy) {
        this.snapshot = new Snapshot(Objects.requireNonNull(hierarchy, "hierarchy"));
    }

    public RoleHierarchy hierarchy() {
        return snapshot.hierarchy;
    }

    /**
     * Replaces the hierarchy and drops every memoised result.
     */
    public void reload(RoleHierarchy hierarchy) {
        this.snapshot = new Snapshot(Objects.requireNonNull(hierarchy, "hierarchy"));
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[usermn-sdk] role hierarchy reloaded with %d roles", hierarchy.roles().size()));
    }

    /**
     * Union of the permissions granted to every role in the transitive closure of {@code roles}.
     *
     * @return an immutable set
     */
    public Set<Permission> effectivePermissions(Collection<Role> roles) {
        if (roles == null || roles.isEmpty()) {
            return Set.of();
        }
        Snapshot current = snapshot;
        List<String> key = roles.stream()
            .filter(Objects::nonNull)
            .map(Role::name)
            .distinct()
            .sorted()
            .collect(Collectors.toList());
        return current.cache.computeIfAbsent(key, ignored -> compute(current.hierarchy, roles));
    }

    /**
     * Role-derived permissions plus permissions granted directly to the user.
     */
    public Set<Permission> effectivePermissions(Collection<Role> roles, Collection<Permission> directPermissions) {
        Set<Permission> fromRoles = effectivePermissions(roles);
        if (directPermissions == null || directPermissions.isEmpty()) {
            return fromRoles;
        }
        Set<Permission> merged = new LinkedHashSet<>(fromRoles);
        merged.addAll(directPermissions);
        return Collections.unmodifiableSet(merged);
    }

    /**
     * @return every role held directly or through inheritance
     */
    public Set<Role> roleClosure(Collection<Role> roles) {
        if (roles == null || roles.isEmpty()) {
            return Set.of();
        }
        RoleHierarchy hierarchy = snapshot.hierarchy;
        Set<Role> closure = new LinkedHashSet<>();
        for (Role role : roles) {
            closure.addAll(hierarchy.closure(role));
        }
        return Collections.unmodifiableSet(closure);
    }

    public static boolean hasPermission(Set<Permission> effective, Permission required) {
        if (effective == null || required == null) {
            return false;
        }
        if (effective.contains(required)) {
            return true;
        }
        for (Permission held : effective) {
            if (held.implies(required)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasPermission(Set<Permission> effective, String required) {
        return hasPermission(effective, Permission.of(required));
    }

    public static boolean hasAnyPermission(Set<Permission> effective, Collection<Permission> required) {
        return required.stream().anyMatch(permission -> hasPermission(effective, permission));
    }

    public static boolean hasAllPermissions(Set<Permission> effective, Collection<Permission> required) {
        return required.stream().allMatch(permission -> hasPermission(effective, permission));
    }

    /**
     * True when a held role is one of {@code required}, or inherits one of them ({@code super_admin} satisfies a
     * check for {@code admin}). An empty requirement is never satisfied.
     */
    public boolean hasRole(Collection<Role> held, Collection<Role> required) {
        if (held == null || held.isEmpty() || required == null || required.isEmpty()) {
            return false;
        }
        for (Role role : held) {
            if (required.contains(role)) {
                return true;
            }
        }
        Set<Role> closure = roleClosure(held);
        for (Role role : required) {
            if (closure.contains(role)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasRole(Collection<Role> held, Role... required) {
        return hasRole(held, List.of(required));
    }

    public boolean hasAccess(Set<Permission> effective, Collection<Role> held, AccessRequest request) {
        if (request == null) {
            return true;
        }
        boolean permitted;
        if (request.requiredPermissions().isEmpty()) {
            permitted = true;
        } else if (request.requireAllPermissions()) {
            permitted = hasAllPermissions(effective, request.requiredPermissions());
        } else {
            permitted = hasAnyPermission(effective, request.requiredPermissions());
        }
        if (!permitted) {
            return false;
        }
        return request.requiredRoles().isEmpty() || hasRole(held, request.requiredRoles());
    }

    int cachedEntries() {
        return snapshot.cache.size();
    }

    private static Set<Permission> compute(RoleHierarchy hierarchy, Collection<Role> roles) {
        Set<Permission> permissions = new LinkedHashSet<>();
        for (Role role : roles) {
            if (role == null) {
                continue;
            }
            if (!hierarchy.contains(role)) {
                LOGGER.fine(() -> "[usermn-sdk] ignoring unknown role " + role);
                continue;
            }
            for (Role inherited : hierarchy.closure(role)) {
                permissions.addAll(hierarchy.permissionsOf(inherited));
            }
        }
        return Collections.unmodifiableSet(permissions);
    }

    private static final class Snapshot {
        private final RoleHierarchy hierarchy;
        private final Map<List<String>, Set<Permission>> cache = new ConcurrentHashMap<>();

        private Snapshot(RoleHierarchy hierarchy) {
            this.hierarchy = hierarchy;
        }
    }
}
