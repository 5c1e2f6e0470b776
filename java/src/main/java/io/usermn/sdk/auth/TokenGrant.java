package io.usermn.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.usermn.sdk.UserMnException;
import io.usermn.sdk.internal.Json;

import java.time.Duration;
import java.util.List;

/**
 * Body of a successful login or refresh response.
 */
public record TokenGrant(
    String accessToken,
    String refreshToken,
    String tokenType,
    long expiresInSeconds,
    String userId,
    String email,
    List<String> roles,
    List<String> permissions
) {

    public static final long DEFAULT_EXPIRES_IN = 3600L;

    /**
     * Longest accepted token lifetime. Anything above is treated as a malformed response.
     */
    public static final long MAX_EXPIRES_IN = Duration.ofDays(365).getSeconds();

    public TokenGrant {
        if (expiresInSeconds <= 0L || expiresInSeconds > MAX_EXPIRES_IN) {
            throw new IllegalArgumentException("expiresInSeconds must be in (0, " + MAX_EXPIRES_IN + "]");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static TokenGrant of(String accessToken, String refreshToken, long expiresInSeconds) {
        return new TokenGrant(accessToken, refreshToken, Token.DEFAULT_TOKEN_TYPE, expiresInSeconds,
            null, null, List.of(), List.of());
    }

    /**
     * Decodes {@code {access_token, refresh_token, token_type, expires_in, ...}}, optionally wrapped in the backend's
     * {@code {success, data}} envelope.
     */
    public static TokenGrant decode(JsonNode body) throws UserMnException {
        JsonNode node = Json.unwrapData(body);
        if (node == null || !node.isObject()) {
            throw new UserMnException("token response is not a JSON object");
        }

        String accessToken = Json.text(node, "access_token");
        if (accessToken == null || "undefined".equals(accessToken)) {
            throw new UserMnException("token response missing access_token");
        }

        long expiresIn = expiresIn(node.path("expires_in"));

        String refreshToken = Json.text(node, "refresh_token");
        if ("undefined".equals(refreshToken)) {
            refreshToken = null;
        }

        return new TokenGrant(
            accessToken,
            refreshToken,
            Json.text(node, "token_type"),
            expiresIn,
            Json.text(node, "user_id"),
            Json.text(node, "email"),
            Json.textArray(node, "roles"),
            Json.textArray(node, "permissions")
        );
    }

    private static long expiresIn(JsonNode expiresNode) throws UserMnException {
        if (expiresNode.isMissingNode() || expiresNode.isNull()) {
            return DEFAULT_EXPIRES_IN;
        }
        long value;
        if (expiresNode.isNumber() && expiresNode.canConvertToLong()) {
            value = expiresNode.longValue();
        } else if (expiresNode.isTextual()) {
            try {
                value = Long.parseLong(expiresNode.textValue().trim());
            } catch (NumberFormatException ex) {
                throw new UserMnException("token response has unparseable expires_in " + expiresNode, ex);
            }
        } else {
            throw new UserMnException("token response has unparseable expires_in " + expiresNode);
        }
        if (value <= 0L || value > MAX_EXPIRES_IN) {
            throw new UserMnException("token response has out-of-range expires_in " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "TokenGrant{userId=" + userId + ", expiresIn=" + expiresInSeconds + ", roles=" + roles + "}";
    }
}
