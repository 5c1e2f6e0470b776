package io.usermn.sdk.rbac;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Composite access requirement evaluated by {@link PermissionEngine#hasAccess}. Required permissions are combined with
 * OR unless {@code requireAllPermissions} is set; the role requirement, when present, is ANDed with the permission
 * result. An empty request allows access.
 */
public record AccessRequest(
    List<Permission> requiredPermissions,
    boolean requireAllPermissions,
    List<Role> requiredRoles
) {

    public AccessRequest {
        requiredPermissions = requiredPermissions == null ? List.of() : List.copyOf(requiredPermissions);
        requiredRoles = requiredRoles == null ? List.of() : List.copyOf(requiredRoles);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AccessRequest anyOf(String... permissions) {
        return builder().permissions(permissions).build();
    }

    public static AccessRequest allOf(String... permissions) {
        return builder().permissions(permissions).requireAllPermissions(true).build();
    }

    public static AccessRequest role(Role... roles) {
        return builder().roles(List.of(roles)).build();
    }

    public static final class Builder {
        private final List<Permission> permissions = new ArrayList<>();
        private final List<Role> roles = new ArrayList<>();
        private boolean requireAll;

        public Builder permission(Permission permission) {
            permissions.add(permission);
            return this;
        }

        public Builder permissions(String... values) {
            for (String value : values) {
                permissions.add(Permission.of(value));
            }
            return this;
        }

        public Builder requireAllPermissions(boolean requireAll) {
            this.requireAll = requireAll;
            return this;
        }

        public Builder roles(Collection<Role> required) {
            roles.addAll(required);
            return this;
        }

        public Builder role(Role role) {
            roles.add(role);
            return this;
        }

        public AccessRequest build() {
            return new AccessRequest(permissions, requireAll, roles);
        }
    }
}
