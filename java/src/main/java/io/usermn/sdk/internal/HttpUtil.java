package io.usermn.sdk.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.usermn.sdk.UserMnException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Helper methods for issuing HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    private static final Set<String> STATE_CHANGING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade");

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> sendJson(HttpClient client, String method, String url, Object payload,
                                                     String bearerToken, Duration timeout)
        throws IOException, InterruptedException, UserMnException {
        return send(client, method, url, encodeJson(payload), bearerToken, Map.of(), timeout);
    }

    /**
     * Serialises a request body once, ahead of any attempt.
     *
     * @return the JSON bytes, or {@code null} for a {@code null} payload
     * @throws UserMnException when Jackson cannot serialise the payload; retrying cannot help
     */
    public static byte[] encodeJson(Object payload) throws UserMnException {
        if (payload == null) {
            return null;
        }
        try {
            return Json.mapper().writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new UserMnException("request body is not serialisable as JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Sends a pre-encoded JSON body. Caller headers go first; {@code Authorization} is always the SDK's when a bearer
     * token is given, and {@code Accept}/{@code Content-Type} default to JSON unless the caller set them. Names the
     * JDK client refuses to send are skipped.
     */
    public static HttpResponse<InputStream> send(HttpClient client, String method, String url, byte[] body,
                                                 String bearerToken, Map<String, String> headers, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (headers != null) {
            headers.forEach((name, value) -> {
                if (!isRestrictedHeader(name)) {
                    builder.setHeader(name, value);
                }
            });
        }

        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            if (!containsHeader(headers, "Content-Type")) {
                builder.setHeader("Content-Type", "application/json");
            }
        }

        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.setHeader("Authorization", "Bearer " + bearerToken);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }
        if (!containsHeader(headers, "Accept")) {
            builder.setHeader("Accept", "application/json");
        }

        HttpRequest request = builder.build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * @return whether the JDK HTTP client refuses to let callers set this header
     */
    public static boolean isRestrictedHeader(String name) {
        return name != null && RESTRICTED_HEADERS.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean containsHeader(Map<String, String> headers, String name) {
        if (headers == null) {
            return false;
        }
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isStateChanging(String method) {
        return method != null && STATE_CHANGING_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Parses a {@code Retry-After} header given either as delta-seconds or as an HTTP date.
     *
     * @return the delay, or {@code null} when the header is absent or unparseable
     */
    public static Duration retryAfter(HttpHeaders headers, Clock clock) {
        if (headers == null) {
            return null;
        }
        String value = headers.firstValue("Retry-After").map(String::trim).orElse("");
        if (value.isEmpty()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value);
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException ignored) {
            // not delta-seconds; try the HTTP-date form below
        }
        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delta = Duration.between(clock.instant(), at);
            return delta.isNegative() ? Duration.ZERO : delta;
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
