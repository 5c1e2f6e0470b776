package io.usermn.sdk.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.usermn.sdk.ApiException;
import io.usermn.sdk.CircuitOpenException;
import io.usermn.sdk.Config;
import io.usermn.sdk.MutableClock;
import io.usermn.sdk.NetworkException;
import io.usermn.sdk.RequestCancelledException;
import io.usermn.sdk.ServerException;
import io.usermn.sdk.SessionExpiredException;
import io.usermn.sdk.UserMnClient;
import io.usermn.sdk.UserMnException;
import io.usermn.sdk.ValidationException;
import io.usermn.sdk.auth.SessionState;
import io.usermn.sdk.rbac.RoleHierarchy;
import io.usermn.sdk.storage.InMemoryStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResilientApiClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final class BrokenBody {
        public String getName() {
            throw new IllegalStateException("boom");
        }
    }

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger refreshCalls = new AtomicInteger();
    private final AtomicInteger apiCalls = new AtomicInteger();
    private final List<Map<String, String>> seen = new CopyOnWriteArrayList<>();
    private UserMnClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/v1/auth/login", exchange -> respond(exchange, 200, grant("A1", "R1")));
        server.createContext("/api/v1/auth/refresh", exchange -> {
            refreshCalls.incrementAndGet();
            respond(exchange, 200, grant("A2", "R2"));
        });
        server.createContext("/api/v1/auth/csrf-token", exchange ->
            respond(exchange, 200, Map.of("success", true, "data", Map.of("csrf_token", "csrf-1"))));
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void retriesServerErrorsUntilAttemptsAreExhausted() throws Exception {
        client = loggedIn(config());
        items(exchange -> respond(exchange, 503, Map.of("success", false, "message", "maintenance")));

        long start = System.nanoTime();
        ServerException ex = assertThrows(ServerException.class, () -> client.http().get("/api/v1/items"));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(503, ex.getStatusCode());
        assertEquals(3, apiCalls.get());
        assertEquals(List.of("0", "1", "2"), headerValues(ResilientApiClient.RETRY_COUNT_HEADER));
        // 10ms then 20ms of backoff, each at most +20%
        assertTrue(elapsedMillis >= 20, "backoff too short: " + elapsedMillis + "ms");
        assertTrue(elapsedMillis < 5_000, "backoff too long: " + elapsedMillis + "ms");
    }

    @Test
    void recoversWhenServerComesBack() throws Exception {
        client = loggedIn(config());
        items(exchange -> {
            if (apiCalls.get() < 3) {
                respond(exchange, 502, Map.of("success", false));
            } else {
                respond(exchange, 200, Map.of("success", true, "data", Map.of("id", 7)));
            }
        });

        ApiResponse response = client.http().post("/api/v1/items", RequestOptions.builder()
            .body(Map.of("name", "widget"))
            .idempotencyKey("create-widget-1")
            .build());

        assertEquals(200, response.statusCode());
        assertEquals(7, response.data().get("id").asInt());
        assertEquals(List.of("create-widget-1", "create-widget-1", "create-widget-1"),
            headerValues(ResilientApiClient.IDEMPOTENCY_HEADER));
    }

    @Test
    void validationErrorsAreNotRetried() throws Exception {
        client = loggedIn(config());
        items(exchange -> respond(exchange, 422, Map.of(
            "success", false,
            "message", "Validation failed",
            "errors", List.of(Map.of("field", "email", "message", "invalid format")))));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> client.http().post("/api/v1/items", Map.of("email", "nope")));

        assertEquals(1, apiCalls.get());
        assertEquals(List.of("invalid format"), ex.getFieldErrors().get("email"));
    }

    @Test
    void unauthorizedTriggersOneRefreshAndOneRetry() throws Exception {
        client = loggedIn(config());
        items(exchange -> {
            if ("Bearer A1".equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
                respond(exchange, 401, Map.of("success", false, "message", "token expired"));
            } else {
                respond(exchange, 200, Map.of("success", true, "data", List.of()));
            }
        });

        ApiResponse response = client.http().get("/api/v1/items");

        assertEquals(200, response.statusCode());
        assertEquals(1, refreshCalls.get());
        assertEquals(List.of("Bearer A1", "Bearer A2"), headerValues("Authorization"));
        assertEquals("A2", client.tokenStore().read().getAccessToken());
    }

    @Test
    void secondUnauthorizedEndsTheSession() throws Exception {
        client = loggedIn(config());
        items(exchange -> respond(exchange, 401, Map.of("success", false, "message", "revoked")));

        assertThrows(SessionExpiredException.class, () -> client.http().get("/api/v1/items"));

        assertEquals(2, apiCalls.get());
        assertEquals(1, refreshCalls.get());
        assertFalse(client.session().isAuthenticated());
        assertEquals(SessionState.ANONYMOUS, client.session().state());
        assertNull(client.tokenStore().read());
    }

    @Test
    void rateLimitWaitsForRetryAfter() throws Exception {
        client = loggedIn(config());
        items(exchange -> {
            if (apiCalls.get() == 1) {
                exchange.getResponseHeaders().add("Retry-After", "1");
                respond(exchange, 429, Map.of("success", false, "message", "slow down"));
            } else {
                respond(exchange, 200, Map.of("success", true));
            }
        });

        long start = System.nanoTime();
        ApiResponse response = client.http().get("/api/v1/items");
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(200, response.statusCode());
        assertEquals(2, apiCalls.get());
        assertTrue(elapsedMillis >= 900, "Retry-After ignored: " + elapsedMillis + "ms");
    }

    @Test
    void cancellationInterruptsBackoff() throws Exception {
        client = loggedIn(config().retryBaseDelay(Duration.ofSeconds(5)).retryMaxDelay(Duration.ofSeconds(5)));
        CountDownLatch firstAttempt = new CountDownLatch(1);
        items(exchange -> {
            firstAttempt.countDown();
            respond(exchange, 503, Map.of("success", false));
        });
        CancellationSignal cancellation = new CancellationSignal();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.execute(() -> {
                try {
                    if (firstAttempt.await(5, TimeUnit.SECONDS)) {
                        Thread.sleep(50);
                    }
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                cancellation.cancel("component unmounted");
            });

            long start = System.nanoTime();
            RequestCancelledException ex = assertThrows(RequestCancelledException.class, () -> client.http()
                .get("/api/v1/items", RequestOptions.builder().cancellation(cancellation).build()));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals("component unmounted", ex.getMessage());
            assertEquals(1, apiCalls.get());
            assertTrue(elapsedMillis < 3_000, "cancellation was not prompt: " + elapsedMillis + "ms");
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void cancelledBeforeDispatchNeverReachesServer() throws Exception {
        client = loggedIn(config());
        items(exchange -> respond(exchange, 200, Map.of("success", true)));
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        assertThrows(RequestCancelledException.class, () -> client.http()
            .get("/api/v1/items", RequestOptions.builder().cancellation(cancellation).build()));
        assertEquals(0, apiCalls.get());
    }

    @Test
    void csrfHeaderOnlyOnStateChangingRequestsInCookieMode() throws Exception {
        client = loggedIn(config().cookieMode(true));
        items(exchange -> respond(exchange, 200, Map.of("success", true)));

        client.http().get("/api/v1/items");
        client.http().delete("/api/v1/items");

        assertEquals(2, seen.size());
        assertNull(seen.get(0).get(ResilientApiClient.CSRF_HEADER));
        assertEquals("csrf-1", seen.get(1).get(ResilientApiClient.CSRF_HEADER));
    }

    @Test
    void noCsrfHeaderOutsideCookieMode() throws Exception {
        client = loggedIn(config());
        items(exchange -> respond(exchange, 200, Map.of("success", true)));

        client.http().put("/api/v1/items", Map.of("name", "x"));

        assertNull(seen.get(0).get(ResilientApiClient.CSRF_HEADER));
    }

    @Test
    void authenticatedRequestWithoutSessionFailsLocally() {
        client = newClient(config());
        items(exchange -> respond(exchange, 200, Map.of("success", true)));

        assertThrows(SessionExpiredException.class, () -> client.http().get("/api/v1/items"));
        assertEquals(0, apiCalls.get());
    }

    @Test
    void anonymousRequestCarriesNoAuthorization() throws Exception {
        client = newClient(config());
        items(exchange -> respond(exchange, 200, Map.of("success", true)));

        ApiResponse response = client.http().get("/api/v1/items", RequestOptions.builder()
            .authenticated(false)
            .query("page", 2)
            .query("q", "a b")
            .build());

        assertEquals(200, response.statusCode());
        assertNull(seen.get(0).get("Authorization"));
        assertEquals("page=2&q=a+b", seen.get(0).get("query"));
    }

    @Test
    void circuitOpensAfterRepeatedExhaustedFailures() throws Exception {
        client = loggedIn(config()
            .maxAttempts(1)
            .circuitBreakerEnabled(true)
            .circuitFailureThreshold(2));
        items(exchange -> respond(exchange, 500, Map.of("success", false)));

        assertThrows(ServerException.class, () -> client.http().get("/api/v1/items"));
        assertThrows(ServerException.class, () -> client.http().get("/api/v1/items"));
        assertThrows(CircuitOpenException.class, () -> client.http().get("/api/v1/items"));

        assertEquals(2, apiCalls.get());
        assertEquals(CircuitBreaker.State.OPEN, client.http().circuitBreaker().orElseThrow().state());
    }

    @Test
    void unreachableServerSurfacesNetworkException() {
        client = newClient(Config.builder()
            .baseUrl("http://127.0.0.1:1")
            .maxAttempts(2)
            .retryBaseDelay(Duration.ZERO));

        assertThrows(NetworkException.class, () -> client.http()
            .get("/api/v1/items", RequestOptions.builder().authenticated(false).build()));
    }

    @Test
    void unserialisableBodyFailsBeforeAnyAttempt() throws Exception {
        client = loggedIn(config());
        items(exchange -> respond(exchange, 200, Map.of("success", true)));

        long start = System.nanoTime();
        UserMnException ex = assertThrows(UserMnException.class,
            () -> client.http().post("/api/v1/items", new BrokenBody()));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(ex instanceof ApiException, ex.getClass().getName());
        assertTrue(ex.getMessage().contains("boom"), ex.getMessage());
        assertEquals(0, apiCalls.get());
        assertTrue(elapsedMillis < 1_000, "serialisation failure was retried: " + elapsedMillis + "ms");
    }

    @Test
    void callerHeadersCannotReplaceTheSessionToken() throws Exception {
        client = loggedIn(config());
        AtomicReference<List<String>> authorization = new AtomicReference<>();
        AtomicReference<List<String>> accept = new AtomicReference<>();
        items(exchange -> {
            authorization.set(exchange.getRequestHeaders().get("Authorization"));
            accept.set(exchange.getRequestHeaders().get("Accept"));
            respond(exchange, 200, Map.of("success", true));
        });

        client.http().get("/api/v1/items", RequestOptions.builder()
            .header("Authorization", "Bearer forged")
            .header("accept", "text/csv")
            .header("X-Request-Id", "req-1")
            .build());

        assertEquals(List.of("Bearer A1"), authorization.get());
        assertEquals(List.of("text/csv"), accept.get());
    }

    @Test
    void headersOwnedByTheHttpClientAreRejectedUpFront() {
        assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().header("Host", "evil.example"));
        assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().header("Content-Length", "1"));
        assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().header(" ", "x"));
    }

    @Test
    void failedTokenLookupLeavesOpenCircuitUntouched() throws Exception {
        MutableClock clock = new MutableClock();
        client = loggedIn(config()
            .clock(clock)
            .maxAttempts(1)
            .circuitBreakerEnabled(true)
            .circuitFailureThreshold(1)
            .circuitResetTimeout(Duration.ofSeconds(30)));
        AtomicBoolean healthy = new AtomicBoolean();
        items(exchange -> respond(exchange, healthy.get() ? 200 : 500, Map.of("success", healthy.get())));

        assertThrows(ServerException.class, () -> client.http().get("/api/v1/items"));
        CircuitBreaker breaker = client.http().circuitBreaker().orElseThrow();
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());

        clock.advance(Duration.ofSeconds(31));
        client.session().expire("signed out in another tab");
        assertThrows(SessionExpiredException.class, () -> client.http().get("/api/v1/items"));
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        assertEquals(1, apiCalls.get());

        client.login("a@b.com", "secret");
        healthy.set(true);
        client.http().get("/api/v1/items");
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
        client.http().get("/api/v1/items");
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
    }

    private Config.Builder config() {
        return Config.builder()
            .baseUrl(baseUrl)
            .maxAttempts(3)
            .retryBaseDelay(Duration.ofMillis(10))
            .retryMaxDelay(Duration.ofMillis(40));
    }

    private UserMnClient newClient(Config.Builder builder) {
        return new UserMnClient(builder.build(), new InMemoryStorage(), RoleHierarchy.defaults());
    }

    private UserMnClient loggedIn(Config.Builder builder) throws Exception {
        UserMnClient created = newClient(builder);
        created.login("a@b.com", "secret");
        return created;
    }

    private void items(HttpHandler handler) {
        server.createContext("/api/v1/items", exchange -> {
            apiCalls.incrementAndGet();
            Map<String, String> request = new HashMap<>();
            for (String header : List.of("Authorization", ResilientApiClient.RETRY_COUNT_HEADER,
                ResilientApiClient.IDEMPOTENCY_HEADER, ResilientApiClient.CSRF_HEADER)) {
                request.put(header, exchange.getRequestHeaders().getFirst(header));
            }
            request.put("query", exchange.getRequestURI().getRawQuery());
            seen.add(request);
            exchange.getRequestBody().readAllBytes();
            handler.handle(exchange);
        });
    }

    private List<String> headerValues(String name) {
        List<String> values = new ArrayList<>();
        for (Map<String, String> request : seen) {
            values.add(request.get(name));
        }
        return values;
    }

    private static Map<String, Object> grant(String access, String refresh) {
        return Map.of("success", true, "data", Map.of(
            "access_token", access,
            "refresh_token", refresh,
            "token_type", "Bearer",
            "expires_in", 3600,
            "roles", List.of("employee")));
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
