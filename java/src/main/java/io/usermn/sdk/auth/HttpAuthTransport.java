package io.usermn.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.usermn.sdk.ApiException;
import io.usermn.sdk.AuthException;
import io.usermn.sdk.ClientErrorException;
import io.usermn.sdk.Config;
import io.usermn.sdk.NetworkException;
import io.usermn.sdk.RequestCancelledException;
import io.usermn.sdk.UserMnException;
import io.usermn.sdk.internal.ApiErrorDecoder;
import io.usermn.sdk.internal.HttpUtil;
import io.usermn.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AuthTransport} speaking JSON to {@code <baseUrl><authPath>/login|refresh|logout|csrf-token}.
 * Requests are never retried here; a login or refresh is one call.
 */
public final class HttpAuthTransport implements AuthTransport {

    private final Config config;

    public HttpAuthTransport(Config config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public TokenGrant login(Credentials credentials) throws UserMnException {
        Objects.requireNonNull(credentials, "credentials");
        try {
            return TokenGrant.decode(post("login", credentials.toPayload(), null));
        } catch (ClientErrorException ex) {
            if (ex.getStatusCode() == 403 || ex.getStatusCode() == 400) {
                throw new AuthException(ex.getStatusCode(), ex.getCode(), ex.getMessage(), ex.getRequestId());
            }
            throw ex;
        }
    }

    @Override
    public TokenGrant refresh(String refreshToken) throws UserMnException {
        Objects.requireNonNull(refreshToken, "refreshToken");
        return TokenGrant.decode(post("refresh", Map.of("refresh_token", refreshToken), null));
    }

    @Override
    public void logout(String accessToken) throws UserMnException {
        post("logout", null, accessToken);
    }

    @Override
    public String fetchCsrfToken(String accessToken) throws UserMnException {
        JsonNode body = Json.unwrapData(send("GET", "csrf-token", null, accessToken));
        return body == null ? null : Json.text(body, "csrf_token");
    }

    private JsonNode post(String endpoint, Object payload, String bearer) throws UserMnException {
        return send("POST", endpoint, payload, bearer);
    }

    private JsonNode send(String method, String endpoint, Object payload, String bearer) throws UserMnException {
        String url = config.authUrl(endpoint);
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(config.getHttpClient(), method, url, payload, bearer, config.getHttpTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(endpoint + " interrupted", ex);
        } catch (IOException ex) {
            throw new NetworkException(endpoint + ": " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                ApiException apiError = ApiErrorDecoder.decode(response.statusCode(), bodyStream);
                throw apiError;
            }
            byte[] bytes = bodyStream.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            return Json.mapper().readTree(bytes);
        } catch (IOException ex) {
            throw new UserMnException("decode " + endpoint + " response: " + ex.getMessage(), ex);
        }
    }
}
