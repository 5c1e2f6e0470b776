package io.usermn.sdk.auth;

import io.usermn.sdk.UserMnException;

/**
 * Calls to the backend's authentication endpoints.
 */
public interface AuthTransport {

    TokenGrant login(Credentials credentials) throws UserMnException;

    TokenGrant refresh(String refreshToken) throws UserMnException;

    void logout(String accessToken) throws UserMnException;

    /**
     * @return the CSRF secret for cookie mode, or {@code null} when the backend issued none
     */
    String fetchCsrfToken(String accessToken) throws UserMnException;
}
