package io.usermn.sdk;

/**
 * Fatal misconfiguration detected at load time, for example a cycle in the role hierarchy.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
