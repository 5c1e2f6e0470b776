package io.usermn.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;

/**
 * Immutable configuration container used to bootstrap {@link UserMnClient} instances.
 */
public final class Config {

    public static final String DEFAULT_AUTH_PATH = "/api/v1/auth";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TOKEN_SKEW = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RETRY_MAX_DELAY = Duration.ofSeconds(8);
    public static final double DEFAULT_RETRY_JITTER = 0.2d;
    public static final Duration DEFAULT_MAX_RETRY_AFTER = Duration.ofSeconds(60);
    public static final int DEFAULT_CIRCUIT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_CIRCUIT_RESET_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_CIRCUIT_SUCCESS_THRESHOLD = 2;

    private final String baseUrl;
    private final String authPath;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Duration tokenSkew;
    private final int maxAttempts;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final double retryJitter;
    private final Duration maxRetryAfter;
    private final boolean cookieMode;
    private final boolean circuitBreakerEnabled;
    private final int circuitFailureThreshold;
    private final Duration circuitResetTimeout;
    private final int circuitSuccessThreshold;
    private final Clock clock;
    private final Random random;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.authPath = builder.authPath;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.tokenSkew = builder.tokenSkew;
        this.maxAttempts = builder.maxAttempts;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.retryJitter = builder.retryJitter;
        this.maxRetryAfter = builder.maxRetryAfter;
        this.cookieMode = builder.cookieMode;
        this.circuitBreakerEnabled = builder.circuitBreakerEnabled;
        this.circuitFailureThreshold = builder.circuitFailureThreshold;
        this.circuitResetTimeout = builder.circuitResetTimeout;
        this.circuitSuccessThreshold = builder.circuitSuccessThreshold;
        this.clock = builder.clock;
        this.random = builder.random;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("BaseUrl is required");
        }
        String resolvedBaseUrl = sanitizeUrl(baseUrl);
        String resolvedAuthPath = sanitizePath(Optional.ofNullable(authPath).orElse(DEFAULT_AUTH_PATH));

        Duration resolvedTimeout = positiveOr(httpTimeout, DEFAULT_HTTP_TIMEOUT);
        Duration resolvedSkew = Optional.ofNullable(tokenSkew).orElse(DEFAULT_TOKEN_SKEW);
        if (resolvedSkew.isNegative()) {
            throw new IllegalArgumentException("TokenSkew cannot be negative");
        }

        int resolvedAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        Duration resolvedBaseDelay = Optional.ofNullable(retryBaseDelay).orElse(DEFAULT_RETRY_BASE_DELAY);
        if (resolvedBaseDelay.isNegative()) {
            throw new IllegalArgumentException("RetryBaseDelay cannot be negative");
        }
        Duration resolvedMaxDelay = positiveOr(retryMaxDelay, DEFAULT_RETRY_MAX_DELAY);
        if (resolvedMaxDelay.compareTo(resolvedBaseDelay) < 0) {
            resolvedMaxDelay = resolvedBaseDelay;
        }
        double resolvedJitter = Double.isNaN(retryJitter) ? DEFAULT_RETRY_JITTER : retryJitter;
        if (resolvedJitter < 0d || resolvedJitter >= 1d) {
            throw new IllegalArgumentException("RetryJitter must be in [0, 1)");
        }
        Duration resolvedMaxRetryAfter = positiveOr(maxRetryAfter, DEFAULT_MAX_RETRY_AFTER);

        int resolvedFailureThreshold = circuitFailureThreshold <= 0
            ? DEFAULT_CIRCUIT_FAILURE_THRESHOLD : circuitFailureThreshold;
        Duration resolvedResetTimeout = positiveOr(circuitResetTimeout, DEFAULT_CIRCUIT_RESET_TIMEOUT);
        int resolvedSuccessThreshold = circuitSuccessThreshold <= 0
            ? DEFAULT_CIRCUIT_SUCCESS_THRESHOLD : circuitSuccessThreshold;

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .authPath(resolvedAuthPath)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .tokenSkew(resolvedSkew)
            .maxAttempts(resolvedAttempts)
            .retryBaseDelay(resolvedBaseDelay)
            .retryMaxDelay(resolvedMaxDelay)
            .retryJitter(resolvedJitter)
            .maxRetryAfter(resolvedMaxRetryAfter)
            .cookieMode(cookieMode)
            .circuitBreakerEnabled(circuitBreakerEnabled)
            .circuitFailureThreshold(resolvedFailureThreshold)
            .circuitResetTimeout(resolvedResetTimeout)
            .circuitSuccessThreshold(resolvedSuccessThreshold)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .random(Optional.ofNullable(random).orElseGet(Random::new))
            .buildInternal();
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String sanitizePath(String path) {
        String trimmed = path.trim();
        if (trimmed.isEmpty() || "/".equals(trimmed)) {
            return "";
        }
        if (!trimmed.startsWith("/")) {
            trimmed = "/" + trimmed;
        }
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Resolves a request path against the base URL. Absolute URLs are returned unchanged.
     */
    public String resolve(String path) {
        if (path == null || path.isBlank()) {
            return baseUrl;
        }
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        return baseUrl + (path.startsWith("/") ? path : "/" + path);
    }

    public String authUrl(String endpoint) {
        return resolve(authPath + "/" + endpoint);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getAuthPath() {
        return authPath;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getTokenSkew() {
        return tokenSkew;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public double getRetryJitter() {
        return retryJitter;
    }

    public Duration getMaxRetryAfter() {
        return maxRetryAfter;
    }

    public boolean isCookieMode() {
        return cookieMode;
    }

    public boolean isCircuitBreakerEnabled() {
        return circuitBreakerEnabled;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public Duration getCircuitResetTimeout() {
        return circuitResetTimeout;
    }

    public int getCircuitSuccessThreshold() {
        return circuitSuccessThreshold;
    }

    public Clock getClock() {
        return clock;
    }

    public Random getRandom() {
        return random;
    }

    public static final class Builder {
        private String baseUrl;
        private String authPath;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Duration tokenSkew;
        private int maxAttempts;
        private Duration retryBaseDelay;
        private Duration retryMaxDelay;
        private double retryJitter = Double.NaN;
        private Duration maxRetryAfter;
        private boolean cookieMode;
        private boolean circuitBreakerEnabled;
        private int circuitFailureThreshold;
        private Duration circuitResetTimeout;
        private int circuitSuccessThreshold;
        private Clock clock;
        private Random random;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder authPath(String authPath) {
            this.authPath = authPath;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder tokenSkew(Duration tokenSkew) {
            this.tokenSkew = tokenSkew;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        public Builder retryJitter(double retryJitter) {
            this.retryJitter = retryJitter;
            return this;
        }

        public Builder maxRetryAfter(Duration maxRetryAfter) {
            this.maxRetryAfter = maxRetryAfter;
            return this;
        }

        /**
         * Enables cookie-based secure mode: a CSRF token is fetched after login and sent as {@code X-CSRF-Token} on
         * state-changing requests.
         */
        public Builder cookieMode(boolean cookieMode) {
            this.cookieMode = cookieMode;
            return this;
        }

        public Builder circuitBreakerEnabled(boolean circuitBreakerEnabled) {
            this.circuitBreakerEnabled = circuitBreakerEnabled;
            return this;
        }

        public Builder circuitFailureThreshold(int circuitFailureThreshold) {
            this.circuitFailureThreshold = circuitFailureThreshold;
            return this;
        }

        public Builder circuitResetTimeout(Duration circuitResetTimeout) {
            this.circuitResetTimeout = circuitResetTimeout;
            return this;
        }

        public Builder circuitSuccessThreshold(int circuitSuccessThreshold) {
            this.circuitSuccessThreshold = circuitSuccessThreshold;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
