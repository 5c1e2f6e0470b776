package io.usermn.sdk;

/**
 * Deterministic 4xx failure without field errors (403, 404, 409, ...). Never retried.
 */
public final class ClientErrorException extends ApiException {

    private static final long serialVersionUID = 1L;

    public ClientErrorException(int statusCode, String code, String message, String requestId) {
        super(statusCode, code, message, requestId, null);
    }
}
