package io.usermn.sdk.rbac;

import io.usermn.sdk.ConfigurationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable role inheritance graph plus the permissions granted directly to each role.
 *
 * <p>A role may inherit from any number of parents (the shipped table is a single chain, custom deployments may use a
 * general DAG). The graph is validated when it is built: references to undeclared roles and inheritance cycles are
 * reported as {@link ConfigurationException} so that misconfiguration fails at startup instead of at query time.</p>
 */
public final class RoleHierarchy {

    public static final String DEFAULT_RESOURCE = "io/usermn/sdk/rbac/default-roles.json";

    private final Map<Role, Set<Role>> parents;
    private final Map<Role, Set<Permission>> permissions;

    private RoleHierarchy(Map<Role, Set<Role>> parents, Map<Role, Set<Permission>> permissions) {
        this.parents = parents;
        this.permissions = permissions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the shipped hierarchy (public &lt; user &lt; employee &lt; manager &lt; admin &lt; super_admin, auditor
     * inheriting user) from {@value #DEFAULT_RESOURCE}.
     */
    public static RoleHierarchy defaults() {
        return RoleHierarchyLoader.fromClasspath(DEFAULT_RESOURCE);
    }

    public Set<Role> roles() {
        return parents.keySet();
    }

    public boolean contains(Role role) {
        return parents.containsKey(role);
    }

    public Set<Role> parentsOf(Role role) {
        return parents.getOrDefault(role, Set.of());
    }

    /**
     * @return permissions granted to {@code role} itself, without inheritance
     */
    public Set<Permission> permissionsOf(Role role) {
        return permissions.getOrDefault(role, Set.of());
    }

    /**
     * Breadth-first transitive closure of {@code role} over the inherits-from edges, including the role itself.
     * Unknown roles close over themselves only.
     *
     * @throws ConfigurationException when the walk reaches {@code role} again
     */
    public Set<Role> closure(Role role) {
        Set<Role> visited = new LinkedHashSet<>();
        Deque<Role> queue = new ArrayDeque<>();
        visited.add(role);
        queue.add(role);
        while (!queue.isEmpty()) {
            Role current = queue.poll();
            for (Role parent : parentsOf(current)) {
                if (parent.equals(role)) {
                    throw new ConfigurationException("role hierarchy cycle through " + role);
                }
                if (visited.add(parent)) {
                    queue.add(parent);
                }
            }
        }
        return Collections.unmodifiableSet(visited);
    }

    public static final class Builder {
        private final Map<Role, Set<Role>> parents = new LinkedHashMap<>();
        private final Map<Role, Set<Permission>> permissions = new LinkedHashMap<>();

        public Builder role(Role role, Collection<Role> inherits, Collection<Permission> granted) {
            if (role == null) {
                throw new ConfigurationException("role is required");
            }
            if (parents.containsKey(role)) {
                throw new ConfigurationException("role " + role + " declared twice");
            }
            parents.put(role, inherits == null ? Set.of() : new LinkedHashSet<>(inherits));
            permissions.put(role, granted == null ? Set.of() : new LinkedHashSet<>(granted));
            return this;
        }

        /**
         * String form used by configuration loaders.
         *
         * @throws ConfigurationException when a role name or permission is malformed
         */
        public Builder role(String name, List<String> inherits, List<String> granted) {
            try {
                List<Role> parentRoles = inherits == null ? List.of()
                    : inherits.stream().map(Role::of).collect(Collectors.toList());
                List<Permission> grantedPermissions = granted == null ? List.of()
                    : granted.stream().map(Permission::of).collect(Collectors.toList());
                return role(Role.of(name), parentRoles, grantedPermissions);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException("invalid role definition " + name + ": " + ex.getMessage(), ex);
            }
        }

        public RoleHierarchy build() {
            for (Map.Entry<Role, Set<Role>> entry : parents.entrySet()) {
                for (Role parent : entry.getValue()) {
                    if (!parents.containsKey(parent)) {
                        throw new ConfigurationException(
                            "role " + entry.getKey() + " inherits undeclared role " + parent);
                    }
                }
            }
            detectCycles();

            Map<Role, Set<Role>> frozenParents = new LinkedHashMap<>();
            parents.forEach((role, set) -> frozenParents.put(role, Collections.unmodifiableSet(new TreeSet<>(set))));
            Map<Role, Set<Permission>> frozenPermissions = new HashMap<>();
            permissions.forEach((role, set) -> frozenPermissions.put(role, Set.copyOf(set)));
            return new RoleHierarchy(Collections.unmodifiableMap(frozenParents), Map.copyOf(frozenPermissions));
        }

        private void detectCycles() {
            Map<Role, Integer> state = new HashMap<>();
            for (Role role : parents.keySet()) {
                if (!state.containsKey(role)) {
                    visit(role, state, new ArrayList<>());
                }
            }
        }

        // 1 = on the current path, 2 = fully explored
        private void visit(Role role, Map<Role, Integer> state, List<Role> path) {
            state.put(role, 1);
            path.add(role);
            for (Role parent : parents.getOrDefault(role, Set.of())) {
                Integer seen = state.get(parent);
                if (seen == null) {
                    visit(parent, state, path);
                } else if (seen == 1) {
                    List<Role> cycle = new ArrayList<>(path.subList(path.indexOf(parent), path.size()));
                    cycle.add(parent);
                    throw new ConfigurationException("role hierarchy contains a cycle: "
                        + cycle.stream().map(Role::name).collect(Collectors.joining(" -> ")));
                }
            }
            path.remove(path.size() - 1);
            state.put(role, 2);
        }
    }
}
