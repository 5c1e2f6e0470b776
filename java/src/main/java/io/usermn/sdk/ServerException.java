package io.usermn.sdk;

/**
 * The backend answered with a 5xx status on every attempt.
 */
public final class ServerException extends ApiException {

    private static final long serialVersionUID = 1L;

    public ServerException(int statusCode, String code, String message, String requestId) {
        super(statusCode, code, message, requestId, null);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
