package io.usermn.sdk;

/**
 * The caller cancelled the request, or interrupted the calling thread, before it completed.
 */
public final class RequestCancelledException extends UserMnException {

    private static final long serialVersionUID = 1L;

    public RequestCancelledException(String message) {
        super(message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
