package io.usermn.sdk.auth;

import io.usermn.sdk.Config;
import io.usermn.sdk.storage.KeyValueStorage;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Persists the session token and remember-me preference in a {@link KeyValueStorage}.
 *
 * <p>Every write goes to storage as one commit covering all token keys, so readers either see the previous token or
 * the new one in full. Reads are lock-free snapshots.</p>
 *
 * <p>Mutators are package-private: only {@link SessionManager} changes the stored token.</p>
 */
public final class TokenStore {

    private static final Logger LOGGER = Logger.getLogger(TokenStore.class.getName());

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String TOKEN_TYPE = "token_type";
    static final String TOKEN_EXPIRES_AT = "token_expires_at";
    static final String REMEMBER_ME = "remember_me";
    static final String REMEMBER_ME_EMAIL = "remember_me_email";
    static final String CSRF_TOKEN = "csrf_token";

    private static final Set<String> TOKEN_KEYS = Set.of(ACCESS_TOKEN, REFRESH_TOKEN, TOKEN_TYPE, TOKEN_EXPIRES_AT);

    private final KeyValueStorage storage;
    private final Clock clock;

    public TokenStore(KeyValueStorage storage, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TokenStore(KeyValueStorage storage) {
        this(storage, Clock.systemUTC());
    }

    /**
     * @return the stored token, or {@code null} when none is stored or the stored entry is incomplete
     */
    public Token read() {
        return decode(storage.snapshot());
    }

    public boolean isExpired() {
        return isExpired(Config.DEFAULT_TOKEN_SKEW);
    }

    /**
     * @return {@code true} when {@code now + skew >= expiresAt}, or when no token is stored
     */
    public boolean isExpired(Duration skew) {
        return isExpired(read(), skew);
    }

    public boolean isExpired(Token token, Duration skew) {
        return token == null || token.isExpired(clock.millis(), skew);
    }

    /**
     * @return whole seconds until the stored token expires, {@code 0} when expired or absent
     */
    public long secondsUntilExpiry() {
        Token token = read();
        if (token == null) {
            return 0L;
        }
        return Math.max(0L, (token.getExpiresAtEpochMs() - clock.millis()) / 1000L);
    }

    public RememberMe rememberMe() {
        Map<String, String> snapshot = storage.snapshot();
        boolean enabled = "true".equals(snapshot.get(REMEMBER_ME));
        return new RememberMe(enabled, snapshot.get(REMEMBER_ME_EMAIL));
    }

    public String csrfToken() {
        return storage.get(CSRF_TOKEN);
    }

    /**
     * Stores the grant with its expiry computed from the store clock at the moment of writing.
     */
    Token write(TokenGrant grant, boolean rememberMe) {
        Token token = Token.fromGrant(grant, clock.millis());
        write(token, rememberMe);
        return token;
    }

    Token write(TokenGrant grant, boolean rememberMe, String email) {
        Token token = Token.fromGrant(grant, clock.millis());
        Map<String, String> puts = tokenEntries(token, rememberMe);
        if (rememberMe && email != null && !email.isBlank()) {
            puts.put(REMEMBER_ME_EMAIL, email);
            storage.commit(puts, Set.of());
        } else if (!rememberMe) {
            storage.commit(puts, Set.of(REMEMBER_ME_EMAIL));
        } else {
            storage.commit(puts, Set.of());
        }
        return token;
    }

    void write(Token token, boolean rememberMe) {
        Objects.requireNonNull(token, "token");
        storage.commit(tokenEntries(token, rememberMe), Set.of());
    }

    /**
     * Removes the token and CSRF secret. The remembered email survives only while remember-me is enabled.
     */
    void clear() {
        Set<String> removals = new HashSet<>(TOKEN_KEYS);
        removals.add(CSRF_TOKEN);
        if (!rememberMe().enabled()) {
            removals.add(REMEMBER_ME);
            removals.add(REMEMBER_ME_EMAIL);
        }
        storage.commit(Map.of(), removals);
    }

    void clearRememberMe() {
        storage.commit(Map.of(), Set.of(REMEMBER_ME, REMEMBER_ME_EMAIL));
    }

    void storeCsrfToken(String csrfToken) {
        if (csrfToken == null || csrfToken.isBlank()) {
            storage.commit(Map.of(), Set.of(CSRF_TOKEN));
        } else {
            storage.commit(Map.of(CSRF_TOKEN, csrfToken), Set.of());
        }
    }

    private static Map<String, String> tokenEntries(Token token, boolean rememberMe) {
        Map<String, String> puts = new HashMap<>();
        puts.put(ACCESS_TOKEN, token.getAccessToken());
        // null value removes the key in the same commit
        puts.put(REFRESH_TOKEN, token.getRefreshToken());
        puts.put(TOKEN_TYPE, token.getTokenType());
        puts.put(TOKEN_EXPIRES_AT, Long.toString(token.getExpiresAtEpochMs()));
        puts.put(REMEMBER_ME, rememberMe ? "true" : "false");
        return puts;
    }

    private static Token decode(Map<String, String> snapshot) {
        String accessToken = snapshot.get(ACCESS_TOKEN);
        String expiresAt = snapshot.get(TOKEN_EXPIRES_AT);
        if (accessToken == null || expiresAt == null) {
            return null;
        }
        try {
            return new Token(accessToken, snapshot.get(REFRESH_TOKEN), snapshot.get(TOKEN_TYPE),
                Long.parseLong(expiresAt));
        } catch (IllegalArgumentException ex) {
            LOGGER.warning(() -> "[usermn-sdk] ignoring unreadable stored token: " + ex.getMessage());
            return null;
        }
    }
}
