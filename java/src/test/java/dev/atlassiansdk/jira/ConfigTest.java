package dev.atlassiansdk.jira;

import dev.atlassiansdk.jira.auth.AnonymousCredentials;
import dev.atlassiansdk.jira.auth.BasicCredentials;
import dev.atlassiansdk.jira.auth.BearerTokenCredentials;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder()
            .baseUrl("https://example.atlassian.net/")
            .build();

        assertEquals("https://example.atlassian.net", config.getBaseUrl());
        assertEquals(Config.DEFAULT_API_VERSION, config.getApiVersion());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertEquals(Config.DEFAULT_USER_AGENT, config.getUserAgent());
        assertSame(AnonymousCredentials.INSTANCE, config.getCredentials());
        assertNotNull(config.getHttpClient());
    }

    @Test
    void rejectsMissingOrInvalidBaseUrl() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().baseUrl("   ").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().baseUrl("invalid").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().baseUrl("ftp://example.com").build());
        assertEquals("HTTPS://example.atlassian.net", Config.builder().baseUrl("HTTPS://example.atlassian.net/").build()
            .getBaseUrl());
    }

    @Test
    void honoursCustomSettings() {
        Config config = Config.builder()
            .baseUrl("https://example.atlassian.net")
            .apiVersion(ApiVersion.V2)
            .bearerToken("pat")
            .userAgent("curl/7.54.0")
            .httpTimeout(Duration.ofSeconds(5))
            .build();

        assertEquals(ApiVersion.V2, config.getApiVersion());
        assertEquals("Bearer pat", config.getCredentials().authorizationHeader());
        assertEquals("curl/7.54.0", config.getUserAgent());
        assertEquals(Duration.ofSeconds(5), config.getHttpTimeout());
    }

    @Test
    void nonPositiveTimeoutFallsBackToDefault() {
        Config config = Config.builder()
            .baseUrl("https://example.atlassian.net")
            .httpTimeout(Duration.ZERO)
            .build();

        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
    }

    @Test
    void readsBasicAuthFromEnvironment() {
        Config config = Config.fromEnvironment(Map.of(
            "HOST", "https://example.atlassian.net",
            "MAIL", "dev@example.com",
            "TOKEN", "api-token"
        ));

        BasicCredentials credentials = assertInstanceOf(BasicCredentials.class, config.getCredentials());
        assertEquals("dev@example.com", credentials.getEmail());
    }

    @Test
    void tokenWithoutMailSelectsBearerAuth() {
        Config config = Config.fromEnvironment(Map.of(
            "HOST", "https://example.atlassian.net",
            "TOKEN", "pat",
            "USER_AGENT", "reporting-job"
        ));

        assertInstanceOf(BearerTokenCredentials.class, config.getCredentials());
        assertEquals("reporting-job", config.getUserAgent());
    }

    @Test
    void environmentWithoutHostIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> Config.fromEnvironment(Map.of("TOKEN", "pat")));
        assertTrue(ex.getMessage().contains("HOST"));
    }
}
