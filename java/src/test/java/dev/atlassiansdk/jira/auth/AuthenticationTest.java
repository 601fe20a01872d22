package dev.atlassiansdk.jira.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthenticationTest {

    @Test
    void startsAnonymousWhenNoCredentialsGiven() {
        Authentication authentication = new Authentication(null, "agent");

        assertSame(AnonymousCredentials.INSTANCE, authentication.getCredentials());
        assertNull(authentication.getCredentials().authorizationHeader());
    }

    @Test
    void basicAuthEncodesEmailAndToken() {
        Authentication authentication = new Authentication(null, "agent");
        authentication.setBasicAuth("dev@example.com", "api-token");

        // base64("dev@example.com:api-token")
        assertEquals("Basic ZGV2QGV4YW1wbGUuY29tOmFwaS10b2tlbg==", authentication.getCredentials().authorizationHeader());
    }

    @Test
    void settersRejectBlankValues() {
        Authentication authentication = new Authentication(new BearerTokenCredentials("pat"), "agent");

        assertThrows(IllegalArgumentException.class, () -> authentication.setBasicAuth("", "token"));
        assertThrows(IllegalArgumentException.class, () -> authentication.setBearerToken(" "));
        assertThrows(IllegalArgumentException.class, () -> authentication.setUserAgent(null));
        assertEquals("Bearer pat", authentication.getCredentials().authorizationHeader());
        assertEquals("agent", authentication.getUserAgent());
    }

    @Test
    void tokensAreNotPrinted() {
        assertFalse(new BearerTokenCredentials("secret-pat").toString().contains("secret-pat"));
        assertFalse(new BasicCredentials("dev@example.com", "secret-token").toString().contains("secret-token"));
    }
}
