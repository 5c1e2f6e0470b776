package io.usermn.sdk.auth;

import io.usermn.sdk.ApiException;
import io.usermn.sdk.Config;
import io.usermn.sdk.RequestCancelledException;
import io.usermn.sdk.SessionExpiredException;
import io.usermn.sdk.UserMnException;
import io.usermn.sdk.rbac.AccessRequest;
import io.usermn.sdk.rbac.Permission;
import io.usermn.sdk.rbac.PermissionEngine;
import io.usermn.sdk.rbac.Role;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * <p>
 * Owns the authenticated session: login, logout and token refresh against the {@link TokenStore}, the permission set
 * resolved at login, and notification of state changes. One instance per signed-in client; it is thread-safe and
 * starts no threads of its own.
 * </p>
 *
 * <h2>Refresh</h2>
 * <p>
 * At most one refresh request is in flight at any time. The first caller that finds the token stale creates a
 * {@link CompletableFuture} under {@link #lock}, performs the refresh on its own thread and completes the future;
 * every other caller awaits that same future. The token is written to the store before the future completes, and the
 * handle is cleared under the lock at the same time, so the next expiry starts a fresh refresh.
 * </p>
 * <p>
 * Login, logout and {@link #expire(String)} advance a session generation. A refresh that started under an older
 * generation never writes to the store, so a slow refresh cannot overwrite a newer login or resurrect a logged-out
 * session.
 * </p>
 */
public final class SessionManager implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SessionManager.class.getName());

    private final Config config;
    private final TokenStore store;
    private final AuthTransport transport;
    private final PermissionEngine permissions;

    private final ReentrantLock lock = new ReentrantLock();
    private CompletableFuture<Token> inFlightRefresh;
    private final AtomicLong generation = new AtomicLong();

    private final Object stateLock = new Object();
    private volatile SessionState state = SessionState.ANONYMOUS;
    private volatile Session session;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private boolean initialized;
    private volatile boolean disposed;

    public SessionManager(Config config, TokenStore store, AuthTransport transport, PermissionEngine permissions) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.store = Objects.requireNonNull(store, "store");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.permissions = Objects.requireNonNull(permissions, "permissions");
    }

    /**
     * Restores a persisted session, if any. Identity is recovered from the stored access token's claims. Idempotent.
     */
    public void init() {
        Session restored = null;
        lock.lock();
        try {
            if (initialized) {
                return;
            }
            initialized = true;
            Token token = store.read();
            if (token == null) {
                return;
            }
            if (token.getRefreshToken() == null && store.isExpired(token, config.getTokenSkew())) {
                LOGGER.fine("[usermn-sdk] discarding stored token: expired and not refreshable");
                store.clear();
                return;
            }
            restored = buildSession(null, token, store.rememberMe().rememberedEmail());
            session = restored;
        } finally {
            lock.unlock();
        }
        Session finalRestored = restored;
        LOGGER.info(() -> "[usermn-sdk] restored session for " + describe(finalRestored));
        moveTo(SessionState.AUTHENTICATED);
    }

    /**
     * Authenticates with the backend. No retry: one call, one outcome.
     *
     * @throws io.usermn.sdk.AuthException for rejected credentials
     * @throws UserMnException for transport and decoding failures; the previous state is kept
     */
    public Session login(Credentials credentials) throws UserMnException {
        ensureOpen();
        Objects.requireNonNull(credentials, "credentials");
        SessionState fallback = session == null ? SessionState.ANONYMOUS : SessionState.AUTHENTICATED;
        moveTo(SessionState.AUTHENTICATING);

        Session next;
        Token token;
        try {
            TokenGrant grant = transport.login(credentials);
            lock.lock();
            try {
                generation.incrementAndGet();
                token = store.write(grant, credentials.rememberMe(), credentials.email());
                next = buildSession(grant, token, credentials.email());
                session = next;
            } finally {
                lock.unlock();
            }
        } catch (UserMnException | RuntimeException ex) {
            moveTo(fallback);
            LOGGER.warning(() -> "[usermn-sdk] login failed for " + credentials.email() + ": " + ex.getMessage());
            throw ex;
        }

        if (config.isCookieMode()) {
            loadCsrfToken(token);
        }
        LOGGER.info(() -> "[usermn-sdk] logged in " + describe(next));
        moveTo(SessionState.AUTHENTICATED);
        return next;
    }

    /**
     * Ends the session. The server call is best effort; local state is always cleared. The remembered email
     * survives when remember-me is enabled. Safe to call without a session.
     */
    public void logout() {
        Token token = store.read();
        if (token != null) {
            try {
                transport.logout(token.getAccessToken());
            } catch (UserMnException | RuntimeException ex) {
                LOGGER.warning(() -> "[usermn-sdk] server logout failed, clearing local session anyway: "
                    + ex.getMessage());
            }
        }

        boolean hadSession;
        lock.lock();
        try {
            generation.incrementAndGet();
            hadSession = session != null || token != null;
            store.clear();
            session = null;
        } finally {
            lock.unlock();
        }

        if (hadSession) {
            LOGGER.info("[usermn-sdk] logged out");
            moveTo(SessionState.LOGGED_OUT);
        }
        moveTo(SessionState.ANONYMOUS);
    }

    /**
     * Exchanges the refresh token for a new token, joining the refresh already in flight if there is one.
     *
     * @throws SessionExpiredException when the session cannot be refreshed; the session has been cleared
     * @throws UserMnException for transient failures; the session is kept
     */
    public Token refresh() throws UserMnException {
        ensureOpen();
        return joinOrStartRefresh(null);
    }

    /**
     * Refreshes unless the token that was rejected by the server has already been replaced. A burst of 401s for the
     * same token therefore costs one refresh.
     */
    public Token refreshIfStale(String rejectedAccessToken) throws UserMnException {
        ensureOpen();
        Objects.requireNonNull(rejectedAccessToken, "rejectedAccessToken");
        return joinOrStartRefresh(rejectedAccessToken);
    }

    /**
     * @return the current token when it does not expire within the configured skew, otherwise a refreshed one
     * @throws SessionExpiredException when there is no session or it can no longer be refreshed
     */
    public Token getValidToken() throws UserMnException {
        ensureOpen();
        Token token = store.read();
        if (token == null) {
            throw new SessionExpiredException("no active session");
        }
        if (!store.isExpired(token, config.getTokenSkew())) {
            return token;
        }
        return joinOrStartRefresh(token.getAccessToken());
    }

    /**
     * Drops the session after the server rejected a freshly refreshed token.
     */
    public void expire(String reason) {
        clearSession(reason);
    }

    /**
     * Drops the session only while {@code accessToken} is still the stored token, so that a request failing with an
     * old token cannot end a newer login.
     *
     * @return {@code true} when the session was cleared
     */
    public boolean expireIfCurrent(String accessToken, String reason) {
        lock.lock();
        try {
            Token current = store.read();
            if (current == null || !current.getAccessToken().equals(accessToken)) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        return clearSession(reason);
    }

    /**
     * Replaces roles and direct permissions of the current session, recomputing effective permissions.
     *
     * @throws IllegalStateException when nobody is signed in
     */
    public Session updateIdentity(Collection<Role> roles, Collection<Permission> directPermissions) {
        lock.lock();
        try {
            Session current = session;
            if (current == null) {
                throw new IllegalStateException("no active session");
            }
            List<Role> nextRoles = roles == null ? List.of() : List.copyOf(roles);
            Set<Permission> direct = directPermissions == null ? Set.of() : Set.copyOf(directPermissions);
            Session next = new Session(current.userId(), current.email(), nextRoles, direct,
                permissions.effectivePermissions(nextRoles, direct), current.expiresAt());
            session = next;
            return next;
        } finally {
            lock.unlock();
        }
    }

    public Subscription subscribe(SessionListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public SessionState state() {
        return state;
    }

    public boolean isAuthenticated() {
        return session != null;
    }

    /**
     * @return the current session, or {@code null} when nobody is signed in
     */
    public Session currentSession() {
        return session;
    }

    public Set<Permission> getEffectivePermissions() {
        Session current = session;
        return current == null ? Set.of() : current.effectivePermissions();
    }

    public boolean hasPermission(Permission permission) {
        return PermissionEngine.hasPermission(getEffectivePermissions(), permission);
    }

    public boolean hasPermission(String permission) {
        return hasPermission(Permission.of(permission));
    }

    public boolean hasRole(Role... roles) {
        Session current = session;
        return current != null && permissions.hasRole(current.roles(), roles);
    }

    public boolean hasAccess(AccessRequest request) {
        Session current = session;
        if (current == null) {
            return false;
        }
        return permissions.hasAccess(current.effectivePermissions(), current.roles(), request);
    }

    public RememberMe rememberMe() {
        return store.rememberMe();
    }

    public void clearRememberMe() {
        lock.lock();
        try {
            store.clearRememberMe();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the CSRF secret fetched at login in cookie mode, or {@code null}
     */
    public String csrfToken() {
        return store.csrfToken();
    }

    public Config getConfig() {
        return config;
    }

    public PermissionEngine getPermissionEngine() {
        return permissions;
    }

    /**
     * Detaches every listener. Stored tokens are left in place for the next process. Idempotent.
     */
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        listeners.clear();
    }

    @Override
    public void close() {
        dispose();
    }

    private Token joinOrStartRefresh(String observedAccessToken) throws UserMnException {
        CompletableFuture<Token> handle;
        boolean owner = false;
        long startGeneration = 0L;
        lock.lock();
        try {
            handle = inFlightRefresh;
            if (handle == null) {
                if (observedAccessToken != null) {
                    Token current = store.read();
                    if (current != null && !current.getAccessToken().equals(observedAccessToken)
                        && !store.isExpired(current, config.getTokenSkew())) {
                        return current;
                    }
                }
                handle = new CompletableFuture<>();
                inFlightRefresh = handle;
                startGeneration = generation.get();
                owner = true;
            }
        } finally {
            lock.unlock();
        }
        if (owner) {
            runRefresh(handle, startGeneration);
        }
        return await(handle);
    }

    private void runRefresh(CompletableFuture<Token> handle, long startGeneration) {
        boolean wasAuthenticated = state == SessionState.AUTHENTICATED;
        if (wasAuthenticated) {
            moveTo(SessionState.REFRESHING);
        }
        try {
            Token current = store.read();
            if (current == null || current.getRefreshToken() == null) {
                throw new SessionExpiredException("no refresh token available");
            }
            LOGGER.fine("[usermn-sdk] refreshing access token");
            TokenGrant grant = transport.refresh(current.getRefreshToken());

            Token refreshed;
            lock.lock();
            try {
                if (generation.get() == startGeneration) {
                    refreshed = store.write(grant, store.rememberMe().enabled());
                    Session existing = session;
                    session = existing == null || !grant.roles().isEmpty()
                        ? buildSession(grant, refreshed, existing == null ? null : existing.email())
                        : existing.withExpiry(refreshed.getExpiry());
                } else {
                    // superseded by login or logout; never overwrite the newer state
                    refreshed = store.read();
                }
                release(handle);
            } finally {
                lock.unlock();
            }

            if (refreshed == null) {
                handle.completeExceptionally(new SessionExpiredException("session ended while refreshing"));
                return;
            }
            if (session != null) {
                moveTo(SessionState.AUTHENTICATED);
            }
            handle.complete(refreshed);
        } catch (UserMnException ex) {
            refreshFailed(handle, ex, startGeneration, wasAuthenticated);
        } catch (RuntimeException ex) {
            releaseLocked(handle);
            restoreAfterFailedRefresh(wasAuthenticated);
            handle.completeExceptionally(ex);
        } finally {
            if (!handle.isDone()) {
                releaseLocked(handle);
                handle.completeExceptionally(new UserMnException("token refresh aborted"));
            }
        }
    }

    private void refreshFailed(CompletableFuture<Token> handle, UserMnException ex, long startGeneration,
                               boolean wasAuthenticated) {
        if (isTransient(ex)) {
            LOGGER.warning(() -> "[usermn-sdk] token refresh failed, keeping session: " + ex.getMessage());
            releaseLocked(handle);
            restoreAfterFailedRefresh(wasAuthenticated);
            handle.completeExceptionally(ex);
            return;
        }

        boolean cleared = false;
        Token survivor = null;
        lock.lock();
        try {
            if (generation.get() == startGeneration) {
                generation.incrementAndGet();
                store.clear();
                session = null;
                cleared = true;
            } else {
                survivor = store.read();
            }
            release(handle);
        } finally {
            lock.unlock();
        }

        if (cleared) {
            LOGGER.info(() -> "[usermn-sdk] session expired, refresh rejected: " + ex.getMessage());
            moveTo(SessionState.ANONYMOUS);
        }
        if (survivor != null) {
            // a newer login replaced the session while this refresh was failing
            handle.complete(survivor);
        } else if (ex instanceof SessionExpiredException) {
            handle.completeExceptionally(ex);
        } else {
            handle.completeExceptionally(new SessionExpiredException("session expired: " + ex.getMessage(), ex));
        }
    }

    private static boolean isTransient(UserMnException ex) {
        if (ex instanceof RequestCancelledException) {
            return true;
        }
        return ex instanceof ApiException && ((ApiException) ex).isTransient();
    }

    private void restoreAfterFailedRefresh(boolean wasAuthenticated) {
        if (wasAuthenticated && session != null) {
            moveTo(SessionState.AUTHENTICATED);
        }
    }

    // caller holds lock
    private void release(CompletableFuture<Token> handle) {
        if (inFlightRefresh == handle) {
            inFlightRefresh = null;
        }
    }

    private void releaseLocked(CompletableFuture<Token> handle) {
        lock.lock();
        try {
            release(handle);
        } finally {
            lock.unlock();
        }
    }

    private Token await(CompletableFuture<Token> handle) throws UserMnException {
        try {
            return handle.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("interrupted while waiting for token refresh", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof UserMnException) {
                throw (UserMnException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new UserMnException("token refresh failed", cause);
        }
    }

    private boolean clearSession(String reason) {
        boolean hadSession;
        lock.lock();
        try {
            generation.incrementAndGet();
            hadSession = session != null || store.read() != null;
            store.clear();
            session = null;
        } finally {
            lock.unlock();
        }
        if (hadSession) {
            LOGGER.info(() -> "[usermn-sdk] session expired: " + reason);
        }
        moveTo(SessionState.ANONYMOUS);
        return hadSession;
    }

    private void loadCsrfToken(Token token) {
        try {
            String csrf = transport.fetchCsrfToken(token.getAccessToken());
            lock.lock();
            try {
                store.storeCsrfToken(csrf);
            } finally {
                lock.unlock();
            }
        } catch (UserMnException | RuntimeException ex) {
            LOGGER.warning(() -> "[usermn-sdk] could not fetch CSRF token: " + ex.getMessage());
        }
    }

    private Session buildSession(TokenGrant grant, Token token, String fallbackEmail) {
        DecodedClaims claims = DecodedClaims.decode(token.getAccessToken());

        List<String> roleNames = grant != null && !grant.roles().isEmpty() ? grant.roles() : claims.roles();
        List<String> grantNames = grant != null && !grant.permissions().isEmpty()
            ? grant.permissions() : claims.permissions();

        List<Role> roles = new ArrayList<>();
        for (String name : roleNames) {
            roles.add(Role.of(name));
        }
        Set<Permission> direct = new LinkedHashSet<>();
        for (String value : grantNames) {
            try {
                direct.add(Permission.of(value));
            } catch (IllegalArgumentException ex) {
                LOGGER.fine(() -> "[usermn-sdk] ignoring malformed permission " + value + ": " + ex.getMessage());
            }
        }

        String userId = grant != null && grant.userId() != null ? grant.userId() : claims.subject();
        String email = grant != null && grant.email() != null ? grant.email() : claims.email();
        if (email == null) {
            email = fallbackEmail;
        }
        return new Session(userId, email, roles, direct, permissions.effectivePermissions(roles, direct),
            token.getExpiry());
    }

    private void moveTo(SessionState next) {
        SessionState previous;
        synchronized (stateLock) {
            previous = state;
            if (previous == next) {
                return;
            }
            state = next;
        }
        for (SessionListener listener : listeners) {
            try {
                listener.onStateChange(previous, next);
            } catch (RuntimeException ex) {
                LOGGER.warning(() -> "[usermn-sdk] session listener failed: " + ex.getMessage());
            }
        }
    }

    private void ensureOpen() {
        if (disposed) {
            throw new IllegalStateException("session manager is disposed");
        }
    }

    private static String describe(Session session) {
        if (session == null) {
            return "<none>";
        }
        return (session.email() != null ? session.email() : session.userId()) + " roles=" + session.roles();
    }

    /**
     * Handle to a registered listener; closing it unsubscribes.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
