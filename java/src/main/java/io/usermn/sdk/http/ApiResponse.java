package io.usermn.sdk.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.usermn.sdk.UserMnException;
import io.usermn.sdk.internal.Json;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;

/**
 * Successful (2xx/3xx) response with the body fully read.
 */
public final class ApiResponse {

    private final int statusCode;
    private final HttpHeaders headers;
    private final byte[] body;

    public ApiResponse(int statusCode, HttpHeaders headers, byte[] body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body == null ? new byte[0] : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public HttpHeaders headers() {
        return headers;
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return the parsed body, or {@code null} for an empty body
     */
    public JsonNode json() throws UserMnException {
        if (body.length == 0) {
            return null;
        }
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new UserMnException("decode response body: " + ex.getMessage(), ex);
        }
    }

    /**
     * The {@code data} member of the backend's {@code {success, data}} envelope, or the whole body when not wrapped.
     */
    public JsonNode data() throws UserMnException {
        return Json.unwrapData(json());
    }

    public <T> T as(Class<T> type) throws UserMnException {
        JsonNode node = data();
        if (node == null) {
            return null;
        }
        try {
            return Json.mapper().treeToValue(node, type);
        } catch (IOException ex) {
            throw new UserMnException("decode response as " + type.getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    public <T> T as(TypeReference<T> type) throws UserMnException {
        JsonNode node = data();
        if (node == null) {
            return null;
        }
        try {
            return Json.mapper().readerFor(type).readValue(node);
        } catch (IOException ex) {
            throw new UserMnException("decode response: " + ex.getMessage(), ex);
        }
    }
}
