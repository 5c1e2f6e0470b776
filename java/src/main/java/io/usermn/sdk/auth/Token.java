package io.usermn.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Issued access/refresh token pair. Immutable; a session's token is only ever replaced as a whole.
 */
public final class Token {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    private final String accessToken;
    private final String refreshToken;
    private final String tokenType;
    private final long expiresAtEpochMs;

    /**
     * @throws IllegalArgumentException when the access token is blank or no expiry is set
     */
    public Token(String accessToken, String refreshToken, String tokenType, long expiresAtEpochMs) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken is required");
        }
        if (expiresAtEpochMs <= 0L) {
            throw new IllegalArgumentException("token expiry is required");
        }
        this.accessToken = accessToken;
        this.refreshToken = refreshToken == null || refreshToken.isBlank() ? null : refreshToken;
        this.tokenType = tokenType == null || tokenType.isBlank() ? DEFAULT_TOKEN_TYPE : tokenType;
        this.expiresAtEpochMs = expiresAtEpochMs;
    }

    /**
     * @throws IllegalArgumentException when the expiry does not fit in epoch milliseconds
     */
    static Token fromGrant(TokenGrant grant, long nowEpochMs) {
        long expiresAt;
        try {
            expiresAt = Math.addExact(nowEpochMs, Math.multiplyExact(grant.expiresInSeconds(), 1000L));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("token expiry overflows: expires_in " + grant.expiresInSeconds(), ex);
        }
        return new Token(grant.accessToken(), grant.refreshToken(), grant.tokenType(), expiresAt);
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * @return the refresh token, or {@code null} when the backend did not issue one
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public long getExpiresAtEpochMs() {
        return expiresAtEpochMs;
    }

    public Instant getExpiry() {
        return Instant.ofEpochMilli(expiresAtEpochMs);
    }

    public boolean isExpired(long nowEpochMs, Duration skew) {
        return nowEpochMs + skew.toMillis() >= expiresAtEpochMs;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Token)) {
            return false;
        }
        Token that = (Token) other;
        return expiresAtEpochMs == that.expiresAtEpochMs
            && accessToken.equals(that.accessToken)
            && Objects.equals(refreshToken, that.refreshToken)
            && tokenType.equals(that.tokenType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, refreshToken, tokenType, expiresAtEpochMs);
    }

    @Override
    public String toString() {
        return "Token{type=" + tokenType + ", expiresAt=" + getExpiry() + ", refreshable=" + (refreshToken != null) + "}";
    }
}
