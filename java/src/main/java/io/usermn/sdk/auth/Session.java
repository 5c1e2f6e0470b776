package io.usermn.sdk.auth;

import io.usermn.sdk.rbac.Permission;
import io.usermn.sdk.rbac.Role;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Identity of the signed-in user together with the permission set resolved at login. Replaced as a whole whenever
 * roles or direct permissions change.
 */
public record Session(
    String userId,
    String email,
    List<Role> roles,
    Set<Permission> directPermissions,
    Set<Permission> effectivePermissions,
    Instant expiresAt
) {

    public Session {
        roles = roles == null ? List.of() : List.copyOf(roles);
        directPermissions = directPermissions == null ? Set.of() : Set.copyOf(directPermissions);
        effectivePermissions = effectivePermissions == null ? Set.of() : Set.copyOf(effectivePermissions);
    }

    Session withExpiry(Instant expiry) {
        return new Session(userId, email, roles, directPermissions, effectivePermissions, expiry);
    }
}
