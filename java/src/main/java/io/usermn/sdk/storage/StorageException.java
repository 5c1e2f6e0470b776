package io.usermn.sdk.storage;

/**
 * Raised when a storage commit cannot be persisted.
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
