package io.usermn.sdk.http;

import io.usermn.sdk.ApiException;
import io.usermn.sdk.Config;
import io.usermn.sdk.NetworkException;
import io.usermn.sdk.RateLimitedException;
import io.usermn.sdk.RequestCancelledException;
import io.usermn.sdk.SessionExpiredException;
import io.usermn.sdk.UserMnException;
import io.usermn.sdk.auth.SessionManager;
import io.usermn.sdk.auth.Token;
import io.usermn.sdk.internal.ApiErrorDecoder;
import io.usermn.sdk.internal.HttpUtil;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * <p>
 * HTTP client for the admin backend that attaches the session's bearer token and survives transient failures.
 * Thread-safe; share one instance per {@link SessionManager}.
 * </p>
 *
 * <h2>Per request</h2>
 * <ol>
 *   <li>Checks cancellation, obtains a valid token from {@link SessionManager#getValidToken()}.</li>
 *   <li>Sends {@code Authorization}, and in cookie mode {@code X-CSRF-Token} on state-changing methods. An
 *       {@code Idempotency-Key} is sent unchanged on every attempt.</li>
 *   <li>Network failures and 5xx are retried up to {@code maxAttempts} with jittered exponential backoff. 429 waits for
 *       {@code Retry-After} when present. Other 4xx are returned to the caller at once.</li>
 *   <li>The first 401 triggers one refresh and exactly one retry. A second 401 ends the session with
 *       {@link SessionExpiredException}.</li>
 * </ol>
 */
public final class ResilientApiClient {

    private static final Logger LOGGER = Logger.getLogger(ResilientApiClient.class.getName());

    static final String CSRF_HEADER = "X-CSRF-Token";
    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    static final String RETRY_COUNT_HEADER = "X-Retry-Count";

    private final Config config;
    private final SessionManager session;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;

    public ResilientApiClient(Config config, SessionManager session) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.session = Objects.requireNonNull(session, "session");
        this.retryPolicy = RetryPolicy.from(this.config);
        this.circuitBreaker = this.config.isCircuitBreakerEnabled()
            ? CircuitBreaker.from(this.config.getBaseUrl(), this.config) : null;
    }

    public ApiResponse get(String path) throws UserMnException {
        return request("GET", path, RequestOptions.none());
    }

    public ApiResponse get(String path, RequestOptions options) throws UserMnException {
        return request("GET", path, options);
    }

    public ApiResponse post(String path, Object body) throws UserMnException {
        return request("POST", path, RequestOptions.body(body));
    }

    public ApiResponse post(String path, RequestOptions options) throws UserMnException {
        return request("POST", path, options);
    }

    public ApiResponse put(String path, Object body) throws UserMnException {
        return request("PUT", path, RequestOptions.body(body));
    }

    public ApiResponse patch(String path, Object body) throws UserMnException {
        return request("PATCH", path, RequestOptions.body(body));
    }

    public ApiResponse delete(String path) throws UserMnException {
        return request("DELETE", path, RequestOptions.none());
    }

    /**
     * Performs one logical request, retrying as described on the class.
     *
     * @throws SessionExpiredException when no valid session exists or the server rejects a refreshed token
     * @throws RequestCancelledException when cancelled or interrupted before completion
     * @throws UserMnException when the body cannot be serialised; nothing is sent
     * @throws io.usermn.sdk.ApiException the decoded failure once retries are exhausted or for non-retryable statuses
     */
    public ApiResponse request(String method, String path, RequestOptions options) throws UserMnException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        RequestOptions opts = options == null ? RequestOptions.none() : options;
        String verb = method.toUpperCase(Locale.ROOT);
        String url = withQuery(config.resolve(path), opts.getQuery());
        CancellationSignal cancellation = opts.getCancellation() == null
            ? new CancellationSignal() : opts.getCancellation();
        Duration timeout = opts.getTimeout() == null ? config.getHttpTimeout() : opts.getTimeout();

        byte[] payload = HttpUtil.encodeJson(opts.getBody());

        int attempt = 0;
        int retries = 0;
        boolean refreshed = false;
        while (true) {
            cancellation.throwIfCancelled();
            Token token = opts.isAuthenticated() ? session.getValidToken() : null;
            cancellation.throwIfCancelled();

            // only once the attempt is certain to be dispatched
            if (circuitBreaker != null) {
                circuitBreaker.acquire();
            }

            attempt++;
            AuditableRequest audit = new AuditableRequest(verb, path, attempt, opts.getIdempotencyKey());
            Map<String, String> headers = headersFor(verb, opts, attempt - 1);

            HttpResponse<InputStream> response;
            byte[] body;
            ApiException failure;
            try {
                response = HttpUtil.send(config.getHttpClient(), verb, url, payload,
                    token == null ? null : token.getAccessToken(), headers, timeout);
                try (InputStream stream = response.body()) {
                    body = stream == null ? new byte[0] : stream.readAllBytes();
                }
                failure = null;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new RequestCancelledException(audit + " interrupted", ex);
            } catch (IOException ex) {
                response = null;
                body = null;
                failure = new NetworkException(audit + ": " + ex.getMessage(), ex);
            }

            if (failure == null) {
                int status = response.statusCode();
                if (status < 400) {
                    recordSuccess();
                    if (attempt > 1) {
                        LOGGER.fine(() -> "[usermn-sdk] " + audit + " succeeded with " + status);
                    }
                    return new ApiResponse(status, response.headers(), body);
                }

                if (status == 401 && token != null) {
                    recordSuccess();
                    if (refreshed) {
                        LOGGER.warning(() -> "[usermn-sdk] " + audit + " rejected after token refresh");
                        session.expireIfCurrent(token.getAccessToken(), "request rejected after token refresh");
                        throw new SessionExpiredException("request rejected after token refresh");
                    }
                    refreshed = true;
                    LOGGER.fine(() -> "[usermn-sdk] " + audit + " got 401, refreshing token");
                    session.refreshIfStale(token.getAccessToken());
                    continue;
                }

                Duration retryAfter = cappedRetryAfter(HttpUtil.retryAfter(response.headers(), config.getClock()));
                failure = ApiErrorDecoder.decode(status, body, retryAfter);
            }

            if (!failure.isTransient()) {
                recordSuccess();
                throw failure;
            }
            if (retries + 1 >= retryPolicy.getMaxAttempts()) {
                recordFailure();
                ApiException exhausted = failure;
                LOGGER.warning(() -> "[usermn-sdk] " + audit + " failed after " + retryPolicy.getMaxAttempts()
                    + " attempts: " + exhausted.getMessage());
                throw failure;
            }

            Duration delay = backoff(failure, retries);
            retries++;
            ApiException retrying = failure;
            LOGGER.fine(() -> "[usermn-sdk] " + audit + " failed (" + retrying.getMessage() + "), retrying in "
                + delay.toMillis() + "ms");
            cancellation.sleep(delay);
        }
    }

    /**
     * @return the circuit breaker guarding this client, if enabled
     */
    public Optional<CircuitBreaker> circuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }

    public SessionManager session() {
        return session;
    }

    private Map<String, String> headersFor(String verb, RequestOptions opts, int retryCount) {
        Map<String, String> headers = new LinkedHashMap<>(opts.getHeaders());
        if (config.isCookieMode() && HttpUtil.isStateChanging(verb)) {
            String csrf = session.csrfToken();
            if (csrf != null) {
                headers.put(CSRF_HEADER, csrf);
            }
        }
        if (opts.getIdempotencyKey() != null) {
            headers.put(IDEMPOTENCY_HEADER, opts.getIdempotencyKey());
        }
        headers.put(RETRY_COUNT_HEADER, Integer.toString(retryCount));
        return headers;
    }

    private Duration backoff(ApiException failure, int retry) {
        if (failure instanceof RateLimitedException) {
            Optional<Duration> retryAfter = ((RateLimitedException) failure).getRetryAfter();
            if (retryAfter.isPresent()) {
                return retryAfter.get();
            }
        }
        return retryPolicy.delayFor(retry);
    }

    private Duration cappedRetryAfter(Duration retryAfter) {
        if (retryAfter == null) {
            return null;
        }
        Duration cap = config.getMaxRetryAfter();
        return retryAfter.compareTo(cap) > 0 ? cap : retryAfter;
    }

    private void recordSuccess() {
        if (circuitBreaker != null) {
            circuitBreaker.recordSuccess();
        }
    }

    private void recordFailure() {
        if (circuitBreaker != null) {
            circuitBreaker.recordFailure();
        }
    }

    private static String withQuery(String url, Map<String, String> query) {
        if (query.isEmpty()) {
            return url;
        }
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((name, value) -> joiner.add(
            URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return url + (url.contains("?") ? "&" : "?") + joiner;
    }
}
