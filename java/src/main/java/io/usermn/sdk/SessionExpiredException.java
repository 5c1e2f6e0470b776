package io.usermn.sdk;

/**
 * The session can no longer be used: the refresh token was rejected, no session exists, or the backend answered
 * 401 again after a successful refresh. The session has already been cleared when this is thrown; callers are
 * expected to send the user back to the login screen.
 */
public final class SessionExpiredException extends ApiException {

    private static final long serialVersionUID = 1L;

    public SessionExpiredException(String message) {
        super(401, "SESSION_EXPIRED", message, null, null);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(401, "SESSION_EXPIRED", message, null, cause);
    }
}
