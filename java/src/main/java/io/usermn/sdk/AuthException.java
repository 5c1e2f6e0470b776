package io.usermn.sdk;

/**
 * Credentials were rejected. Never retried.
 */
public final class AuthException extends ApiException {

    private static final long serialVersionUID = 1L;

    public AuthException(int statusCode, String code, String message, String requestId) {
        super(statusCode, code, message, requestId, null);
    }

    public AuthException(String message) {
        super(401, null, message, null, null);
    }
}
