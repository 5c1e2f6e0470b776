package io.usermn.sdk.http;

import io.usermn.sdk.internal.HttpUtil;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request settings for {@link ResilientApiClient}. Immutable; build with {@link #builder()}.
 */
public final class RequestOptions {

    private static final RequestOptions NONE = builder().build();

    private final Object body;
    private final Map<String, String> headers;
    private final Map<String, String> query;
    private final String idempotencyKey;
    private final CancellationSignal cancellation;
    private final boolean authenticated;
    private final Duration timeout;

    private RequestOptions(Builder builder) {
        this.body = builder.body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(builder.query));
        this.idempotencyKey = builder.idempotencyKey;
        this.cancellation = builder.cancellation;
        this.authenticated = builder.authenticated;
        this.timeout = builder.timeout;
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static RequestOptions body(Object body) {
        return builder().body(body).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Map<String, String> getQuery() {
        return query;
    }

    /**
     * @return the key sent unchanged on every attempt of this logical request, or {@code null}
     */
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    /**
     * @return a per-request timeout overriding {@code Config.httpTimeout}, or {@code null}
     */
    public Duration getTimeout() {
        return timeout;
    }

    public static final class Builder {
        private Object body;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> query = new LinkedHashMap<>();
        private String idempotencyKey;
        private CancellationSignal cancellation;
        private boolean authenticated = true;
        private Duration timeout;

        private Builder() {
        }

        /**
         * JSON body; anything Jackson can serialise.
         */
        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        /**
         * Extra request header. {@code Authorization} is replaced by the session's bearer token on authenticated
         * requests.
         *
         * @throws IllegalArgumentException for headers managed by the HTTP client itself, such as {@code Host}
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (name.isBlank() || HttpUtil.isRestrictedHeader(name)) {
                throw new IllegalArgumentException("header " + name + " cannot be set on a request");
            }
            headers.put(name, value);
            return this;
        }

        public Builder query(String name, Object value) {
            Objects.requireNonNull(name, "name");
            if (value != null) {
                query.put(name, String.valueOf(value));
            }
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        /**
         * Set to {@code false} for endpoints that must be called without a bearer token.
         */
        public Builder authenticated(boolean authenticated) {
            this.authenticated = authenticated;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
