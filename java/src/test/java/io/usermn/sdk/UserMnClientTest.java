package io.usermn.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.usermn.sdk.auth.AccessDecision;
import io.usermn.sdk.auth.Credentials;
import io.usermn.sdk.auth.SessionState;
import io.usermn.sdk.http.ApiResponse;
import io.usermn.sdk.http.RequestOptions;
import io.usermn.sdk.rbac.AccessRequest;
import io.usermn.sdk.rbac.Role;
import io.usermn.sdk.rbac.RoleHierarchy;
import io.usermn.sdk.storage.FileStorage;
import io.usermn.sdk.storage.InMemoryStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UserMnClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;
    private String managerToken;
    private final MutableClock clock = new MutableClock();
    private final AtomicInteger refreshCalls = new AtomicInteger();
    private final AtomicInteger logoutCalls = new AtomicInteger();
    private final List<String> logoutBearers = new CopyOnWriteArrayList<>();
    private final List<String> apiBearers = new CopyOnWriteArrayList<>();
    private final CountDownLatch releaseRefresh = new CountDownLatch(1);
    private volatile boolean holdRefresh;

    @BeforeEach
    void setUp() throws IOException {
        managerToken = jwt(Map.of("sub", "u-7", "email", "m@corp.io", "roles", List.of("manager")));
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/api/v1/auth/login", exchange -> {
            Map<?, ?> body = MAPPER.readValue(exchange.getRequestBody(), Map.class);
            if (!"secret".equals(body.get("password"))) {
                respond(exchange, 401, Map.of("success", false, "message", "Invalid email or password",
                    "message_code", "INVALID_CREDENTIALS"));
                return;
            }
            respond(exchange, 200, grant(managerToken, "R1", List.of("manager")));
        });
        server.createContext("/api/v1/auth/refresh", exchange -> {
            refreshCalls.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            if (holdRefresh) {
                try {
                    releaseRefresh.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            respond(exchange, 200, grant("A2", "R2", List.of("manager")));
        });
        server.createContext("/api/v1/auth/logout", exchange -> {
            logoutCalls.incrementAndGet();
            logoutBearers.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/api/v1/users", exchange -> {
            apiBearers.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            respond(exchange, 200, Map.of("success", true, "data", List.of(Map.of("id", "u-1"))));
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void managerLoginResolvesInheritedPermissions() throws Exception {
        try (UserMnClient client = new UserMnClient(config())) {
            client.login("m@corp.io", "secret");

            assertTrue(client.session().isAuthenticated());
            assertTrue(client.hasRole(Role.EMPLOYEE));
            assertTrue(client.hasRole("user"));
            assertFalse(client.hasRole(Role.ADMIN));
            assertTrue(client.hasPermission("users:manage_team"));
            assertTrue(client.hasPermission("users:view_list"));
            assertTrue(client.hasPermission("profile:edit_own"));
            assertFalse(client.hasPermission("rbac:assign"));
            assertEquals(AccessDecision.FORBIDDEN,
                client.accessGuard().check(AccessRequest.anyOf("users:delete")));
            assertEquals(AccessDecision.ALLOWED,
                client.accessGuard().check(AccessRequest.role(Role.MANAGER)));

            ApiResponse response = client.request("GET", "/api/v1/users", RequestOptions.none());
            assertEquals("u-1", response.data().get(0).get("id").asText());
            assertEquals(List.of("Bearer " + managerToken), apiBearers);
        }
    }

    @Test
    void rejectedCredentialsLeaveClientAnonymous() {
        try (UserMnClient client = new UserMnClient(config())) {
            AuthException ex = assertThrows(AuthException.class, () -> client.login("m@corp.io", "wrong"));

            assertEquals("INVALID_CREDENTIALS", ex.getCode());
            assertEquals(SessionState.ANONYMOUS, client.session().state());
            assertTrue(client.getEffectivePermissions().isEmpty());
            assertEquals(AccessDecision.UNAUTHENTICATED,
                client.accessGuard().check(AccessRequest.anyOf("profile:view_own")));
        }
    }

    @Test
    void concurrentRequestsShareOneRefresh() throws Exception {
        try (UserMnClient client = new UserMnClient(config())) {
            client.login("m@corp.io", "secret");
            clock.advance(Duration.ofSeconds(3600 - 30));
            holdRefresh = true;

            ExecutorService callers = Executors.newFixedThreadPool(8);
            try {
                List<Future<ApiResponse>> results = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    results.add(callers.submit(() -> client.http().get("/api/v1/users")));
                }
                Thread.sleep(100);
                releaseRefresh.countDown();
                for (Future<ApiResponse> result : results) {
                    assertEquals(200, result.get(10, TimeUnit.SECONDS).statusCode());
                }
            } finally {
                callers.shutdownNow();
            }

            assertEquals(1, refreshCalls.get());
            assertEquals(8, apiBearers.size());
            assertTrue(apiBearers.stream().allMatch("Bearer A2"::equals), apiBearers.toString());
            assertEquals("A2", client.tokenStore().read().getAccessToken());
            assertEquals("R2", client.tokenStore().read().getRefreshToken());
        }
    }

    @Test
    void persistedSessionSurvivesRestartUntilLogout() throws Exception {
        Path file = tempDir.resolve("session.json");
        try (UserMnClient first = new UserMnClient(config(), new FileStorage(file), RoleHierarchy.defaults())) {
            first.login(new Credentials("m@corp.io", "secret", true));
        }

        try (UserMnClient second = new UserMnClient(config(), new FileStorage(file), RoleHierarchy.defaults())) {
            second.init();

            assertEquals(SessionState.AUTHENTICATED, second.session().state());
            assertEquals("u-7", second.session().currentSession().userId());
            assertTrue(second.hasRole(Role.MANAGER));
            assertTrue(second.hasPermission("audit:view_all_logs"));

            second.logout();

            assertEquals(1, logoutCalls.get());
            assertEquals(List.of("Bearer " + managerToken), logoutBearers);
            assertFalse(second.session().isAuthenticated());
            assertNull(second.tokenStore().read());
            assertEquals("m@corp.io", second.tokenStore().rememberMe().rememberedEmail());
        }

        try (UserMnClient third = new UserMnClient(config(), new FileStorage(file), RoleHierarchy.defaults())) {
            third.init();
            assertEquals(SessionState.ANONYMOUS, third.session().state());
        }
    }

    @Test
    void closedClientRejectsLogin() {
        UserMnClient client = new UserMnClient(config(), new InMemoryStorage(), RoleHierarchy.defaults());
        client.close();

        assertThrows(IllegalStateException.class, () -> client.login("m@corp.io", "secret"));
    }

    private Config config() {
        return Config.builder()
            .baseUrl(baseUrl)
            .clock(clock)
            .retryBaseDelay(Duration.ofMillis(10))
            .build();
    }

    private static Map<String, Object> grant(String access, String refresh, List<String> roles) {
        return Map.of("success", true, "data", Map.of(
            "access_token", access,
            "refresh_token", refresh,
            "token_type", "Bearer",
            "expires_in", 3600,
            "roles", roles));
    }

    private static String jwt(Map<String, Object> claims) throws IOException {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8))
            + "." + encoder.encodeToString(MAPPER.writeValueAsBytes(claims)) + "._";
    }

    private static void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
