package io.usermn.sdk.auth;

import io.usermn.sdk.rbac.AccessRequest;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Route-level access check over the current session.
 */
public final class AccessGuard {

    private static final Logger LOGGER = Logger.getLogger(AccessGuard.class.getName());

    private final SessionManager session;

    public AccessGuard(SessionManager session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    public AccessDecision check(AccessRequest request) {
        Session current = session.currentSession();
        if (current == null) {
            return AccessDecision.UNAUTHENTICATED;
        }
        if (session.getPermissionEngine().hasAccess(current.effectivePermissions(), current.roles(), request)) {
            return AccessDecision.ALLOWED;
        }
        LOGGER.fine(() -> "[usermn-sdk] access denied for " + current.userId() + ": " + request);
        return AccessDecision.FORBIDDEN;
    }

    /**
     * Convenience for conditional rendering: {@code true} only when {@link #check} allows.
     */
    public boolean canAccess(AccessRequest request) {
        return check(request).isAllowed();
    }
}
