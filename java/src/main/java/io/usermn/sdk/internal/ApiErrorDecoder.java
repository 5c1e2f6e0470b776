package io.usermn.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.usermn.sdk.ApiException;
import io.usermn.sdk.AuthException;
import io.usermn.sdk.ClientErrorException;
import io.usermn.sdk.RateLimitedException;
import io.usermn.sdk.ServerException;
import io.usermn.sdk.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes backend error payloads into the {@link ApiException} variants. This is the only place where status codes
 * and error bodies are interpreted.
 *
 * <p>Understands the backend envelope
 * {@code {"success":false,"message":..,"message_code":..,"field_errors":{field:[..]},"errors":[{field,code,message}],"request_id":..}}
 * as well as the simpler {@code {"code":..,"message":..}} and {@code {"error":..}} shapes.</p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static ApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        return decode(statusCode, bodyStream == null ? new byte[0] : bodyStream.readAllBytes(), null);
    }

    public static ApiException decode(int statusCode, byte[] bytes, Duration retryAfter) {
        ErrorBody body = parse(bytes);

        if (statusCode == 401) {
            return new AuthException(statusCode, body.code, body.message, body.requestId);
        }
        if (statusCode == 429) {
            return new RateLimitedException(body.code, body.message, body.requestId, retryAfter);
        }
        if (statusCode >= 500) {
            return new ServerException(statusCode, body.code, body.message, body.requestId);
        }
        if (!body.fieldErrors.isEmpty() || statusCode == 422) {
            return new ValidationException(statusCode, body.code, body.message, body.requestId, body.fieldErrors);
        }
        return new ClientErrorException(statusCode, body.code, body.message, body.requestId);
    }

    private static ErrorBody parse(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new ErrorBody(null, null, null, Map.of());
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(bytes);
        } catch (IOException ex) {
            return new ErrorBody(null, new String(bytes, StandardCharsets.UTF_8), null, Map.of());
        }
        if (node == null || !node.isObject()) {
            return new ErrorBody(null, new String(bytes, StandardCharsets.UTF_8), null, Map.of());
        }

        String code = Json.text(node, "message_code");
        if (code == null) {
            code = Json.text(node, "code");
        }
        String message = Json.text(node, "message");
        if (message == null && node.path("error").isTextual()) {
            message = Json.text(node, "error");
        }
        if (message == null) {
            message = Json.text(node, "detail");
        }
        return new ErrorBody(code, message, Json.text(node, "request_id"), fieldErrors(node));
    }

    private static Map<String, List<String>> fieldErrors(JsonNode node) {
        Map<String, List<String>> result = new LinkedHashMap<>();

        JsonNode fieldErrors = node.path("field_errors");
        if (fieldErrors.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = fieldErrors.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode value = entry.getValue();
                if (value.isArray()) {
                    value.forEach(item -> add(result, entry.getKey(), item.asText()));
                } else if (value.isTextual()) {
                    add(result, entry.getKey(), value.asText());
                }
            }
        }

        JsonNode errors = node.path("errors");
        if (errors.isArray()) {
            for (JsonNode item : errors) {
                String field = Json.text(item, "field");
                if (field != null) {
                    add(result, field, Json.text(item, "message"));
                }
            }
        }
        return result;
    }

    private static void add(Map<String, List<String>> target, String field, String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        target.computeIfAbsent(field, key -> new ArrayList<>()).add(message);
    }

    private record ErrorBody(String code, String message, String requestId, Map<String, List<String>> fieldErrors) {
    }
}
