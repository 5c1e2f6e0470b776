package io.usermn.sdk.auth;

/**
 * Outcome of an {@link AccessGuard} check. Consumers route {@link #UNAUTHENTICATED} to the login page and
 * {@link #FORBIDDEN} to an access-denied view.
 */
public enum AccessDecision {
    ALLOWED,
    UNAUTHENTICATED,
    FORBIDDEN;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
