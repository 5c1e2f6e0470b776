package io.usermn.sdk.auth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecodedClaimsTest {

    @Test
    void readsIdentityClaims() {
        String payload = "{\"user_id\":\"u-2\",\"email\":\"x@y.com\",\"roles\":[\"manager\",\"\"],\"iat\":10,\"exp\":20}";
        String token = "e30." + Base64.getUrlEncoder().withoutPadding()
            .encodeToString(payload.getBytes(StandardCharsets.UTF_8)) + ".sig";

        DecodedClaims claims = DecodedClaims.decode(token);

        assertEquals("u-2", claims.subject());
        assertEquals("x@y.com", claims.email());
        assertEquals(List.of("manager"), claims.roles());
        assertEquals(10L, claims.issuedAtUnix());
        assertEquals(20L, claims.expiresAtUnix());
        assertFalse(claims.isEmpty());
    }

    @Test
    void opaqueTokensDecodeToEmptyClaims() {
        assertTrue(DecodedClaims.decode("opaque-token").isEmpty());
        assertTrue(DecodedClaims.decode("a.%%%.c").isEmpty());
        assertTrue(DecodedClaims.decode(null).isEmpty());
    }
}
