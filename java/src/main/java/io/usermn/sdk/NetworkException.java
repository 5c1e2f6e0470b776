package io.usermn.sdk;

/**
 * No HTTP response was received (connection refused, reset, timeout).
 */
public final class NetworkException extends ApiException {

    private static final long serialVersionUID = 1L;

    public NetworkException(String message, Throwable cause) {
        super(0, "NETWORK_ERROR", message, null, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
