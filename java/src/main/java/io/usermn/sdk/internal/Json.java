package io.usermn.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Centralised ObjectMapper configuration.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Backend responses are wrapped as {@code {"success":..,"data":{..}}}; returns {@code data} when the envelope is
     * present and the node itself otherwise.
     */
    public static JsonNode unwrapData(JsonNode node) {
        if (node != null && node.isObject() && node.has("success") && node.has("data")) {
            return node.get("data");
        }
        return node;
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }

    public static List<String> textArray(JsonNode node, String field) {
        JsonNode arr = node.path(field);
        if (!arr.isArray()) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        arr.forEach(item -> {
            if (item.isTextual()) {
                String value = item.asText();
                if (!value.isBlank()) {
                    values.add(value);
                }
            }
        });
        return Collections.unmodifiableList(values);
    }
}
