package io.usermn.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.usermn.sdk.internal.Json;

import java.io.IOException;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Identity claims carried in an access token's JWT payload. Used to restore a persisted session without a backend
 * round trip. The signature is not verified; the backend remains the authority.
 */
public record DecodedClaims(
    String subject,
    String email,
    List<String> roles,
    List<String> permissions,
    long issuedAtUnix,
    long expiresAtUnix
) {

    public static DecodedClaims decode(String token) {
        if (token == null) {
            return empty();
        }
        try {
            String[] parts = token.split("\\.");
            if (parts.length < 2) {
                return empty();
            }

            JsonNode node = Json.mapper().readTree(decodeBase64(parts[1]));
            if (node == null || !node.isObject()) {
                return empty();
            }

            String subject = Json.text(node, "sub");
            if (subject == null) {
                subject = Json.text(node, "user_id");
            }

            return new DecodedClaims(
                subject,
                Json.text(node, "email"),
                Json.textArray(node, "roles"),
                Json.textArray(node, "permissions"),
                node.path("iat").isNumber() ? node.path("iat").asLong(0L) : 0L,
                node.path("exp").isNumber() ? node.path("exp").asLong(0L) : 0L
            );
        } catch (IOException | IllegalArgumentException ex) {
            return empty();
        }
    }

    public boolean isEmpty() {
        return subject == null && email == null && roles.isEmpty();
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            return Base64.getDecoder().decode(value);
        }
    }

    private static DecodedClaims empty() {
        return new DecodedClaims(null, null, Collections.emptyList(), Collections.emptyList(), 0L, 0L);
    }
}
