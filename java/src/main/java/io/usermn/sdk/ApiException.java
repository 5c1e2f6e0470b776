package io.usermn.sdk;

/**
 * Error surfaced by an API call. Each concrete subtype is one variant of the failure taxonomy and is decoded exactly
 * once, at the HTTP boundary, by {@link io.usermn.sdk.internal.ApiErrorDecoder}. Callers switch on the type instead of
 * inspecting messages.
 */
public abstract class ApiException extends UserMnException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;
    private final String requestId;

    protected ApiException(int statusCode, String code, String message, String requestId, Throwable cause) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message, cause);
        this.statusCode = statusCode;
        this.code = code;
        this.requestId = requestId;
    }

    /**
     * @return HTTP status code returned by the backend, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return backend error code ({@code message_code} or {@code code}); nullable.
     */
    public String getCode() {
        return code;
    }

    /**
     * @return backend request id when the error payload carried one; nullable.
     */
    public String getRequestId() {
        return requestId;
    }

    /**
     * @return whether the client retries this failure before surfacing it.
     */
    public boolean isTransient() {
        return false;
    }

    private static String defaultMessage(int status, String code) {
        if (status <= 0) {
            return code == null || code.isBlank() ? "request failed" : "request failed (" + code + ")";
        }
        if (code == null || code.isBlank()) {
            return "request failed with status " + status;
        }
        return "request failed with status " + status + " (" + code + ")";
    }
}
