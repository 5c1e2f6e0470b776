package io.usermn.sdk;

/**
 * Base exception thrown by the usermn Java SDK.
 */
public class UserMnException extends Exception {

    private static final long serialVersionUID = 1L;

    public UserMnException(String message) {
        super(message);
    }

    public UserMnException(String message, Throwable cause) {
        super(message, cause);
    }
}
