package io.usermn.sdk;

import io.usermn.sdk.auth.AccessGuard;
import io.usermn.sdk.auth.AuthTransport;
import io.usermn.sdk.auth.Credentials;
import io.usermn.sdk.auth.HttpAuthTransport;
import io.usermn.sdk.auth.Session;
import io.usermn.sdk.auth.SessionManager;
import io.usermn.sdk.auth.TokenStore;
import io.usermn.sdk.http.ApiResponse;
import io.usermn.sdk.http.RequestOptions;
import io.usermn.sdk.http.ResilientApiClient;
import io.usermn.sdk.rbac.PermissionEngine;
import io.usermn.sdk.rbac.Permission;
import io.usermn.sdk.rbac.Role;
import io.usermn.sdk.rbac.RoleHierarchy;
import io.usermn.sdk.storage.InMemoryStorage;
import io.usermn.sdk.storage.KeyValueStorage;

import java.util.Objects;
import java.util.Set;

/**
 * <p>
 * Entry point for applications talking to the user-management backend. Wires the token store, session manager,
 * permission engine and resilient HTTP client together. The client is thread-safe: create one per signed-in user
 * context, call {@link #init()} at startup to restore a persisted session, and {@link #close()} on shutdown.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Refreshes the access token shortly before expiry, with at most one refresh in flight however many requests
 *       are waiting.</li>
 *   <li>Retries network failures, 5xx and 429 with jittered exponential backoff; other 4xx are surfaced at once.</li>
 *   <li>Resolves effective permissions from the role hierarchy once per login; checks are local and cheap.</li>
 * </ul>
 */
public final class UserMnClient implements AutoCloseable {

    private final Config config;
    private final TokenStore tokenStore;
    private final PermissionEngine permissionEngine;
    private final SessionManager sessionManager;
    private final ResilientApiClient http;
    private final AccessGuard accessGuard;

    /**
     * Client with in-memory token storage and the shipped role table.
     */
    public UserMnClient(Config config) {
        this(config, new InMemoryStorage(), RoleHierarchy.defaults());
    }

    public UserMnClient(Config config, KeyValueStorage storage, RoleHierarchy hierarchy) {
        this(config, storage, hierarchy, null);
    }

    /**
     * @param transport authentication transport; {@code null} for the HTTP transport against {@code config}
     */
    public UserMnClient(Config config, KeyValueStorage storage, RoleHierarchy hierarchy, AuthTransport transport) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(hierarchy, "hierarchy");
        this.config = config.withDefaults();
        this.tokenStore = new TokenStore(storage, this.config.getClock());
        this.permissionEngine = new PermissionEngine(hierarchy);
        this.sessionManager = new SessionManager(
            this.config,
            this.tokenStore,
            transport == null ? new HttpAuthTransport(this.config) : transport,
            this.permissionEngine
        );
        this.http = new ResilientApiClient(this.config, this.sessionManager);
        this.accessGuard = new AccessGuard(this.sessionManager);
    }

    /**
     * Restores a session persisted by a previous process, if any. Idempotent.
     */
    public void init() {
        sessionManager.init();
    }

    public Session login(Credentials credentials) throws UserMnException {
        return sessionManager.login(credentials);
    }

    public Session login(String email, String password) throws UserMnException {
        return login(new Credentials(email, password));
    }

    public void logout() {
        sessionManager.logout();
    }

    public Set<Permission> getEffectivePermissions() {
        return sessionManager.getEffectivePermissions();
    }

    public boolean hasPermission(String permission) {
        return sessionManager.hasPermission(permission);
    }

    public boolean hasRole(Role... roles) {
        return sessionManager.hasRole(roles);
    }

    public boolean hasRole(String role) {
        return sessionManager.hasRole(Role.of(role));
    }

    public ApiResponse request(String method, String path, RequestOptions options) throws UserMnException {
        return http.request(method, path, options);
    }

    public SessionManager session() {
        return sessionManager;
    }

    public ResilientApiClient http() {
        return http;
    }

    public AccessGuard accessGuard() {
        return accessGuard;
    }

    public PermissionEngine permissions() {
        return permissionEngine;
    }

    public TokenStore tokenStore() {
        return tokenStore;
    }

    public Config getConfig() {
        return config;
    }

    @Override
    public void close() {
        // httpClient is managed by Config; stored tokens outlive the client.
        sessionManager.dispose();
    }
}
