package io.usermn.sdk.auth;

import java.util.Map;

/**
 * Login credentials. {@link #toString()} never prints the password.
 */
public record Credentials(String email, String password, boolean rememberMe) {

    public Credentials {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password is required");
        }
        email = email.trim();
    }

    public Credentials(String email, String password) {
        this(email, password, false);
    }

    Map<String, Object> toPayload() {
        return Map.of("email", email, "password", password);
    }

    @Override
    public String toString() {
        return "Credentials{email=" + email + ", rememberMe=" + rememberMe + "}";
    }
}
