package dev.atlassiansdk.jira.internal;

import dev.atlassiansdk.jira.JiraApiException;
import dev.atlassiansdk.jira.JiraResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiErrorDecoderTest {

    @Test
    void readsJiraErrorCollection() {
        JiraResponse response = response(400,
            "{\"errorMessages\":[],\"errors\":{\"name\":\"A version with this name already exists in this project.\"}}");

        JiraApiException ex = ApiErrorDecoder.decode(response);

        assertEquals(400, ex.getStatusCode());
        assertTrue(ex.getErrorMessages().isEmpty());
        assertEquals(Map.of("name", "A version with this name already exists in this project."), ex.getErrors());
        assertTrue(ex.getMessage().contains("already exists"));
        assertSame(response, ex.response().orElseThrow());
    }

    @Test
    void fallsBackToRawBodyWhenNotJson() {
        JiraApiException ex = ApiErrorDecoder.decode(response(502, "Bad Gateway"));

        assertEquals(List.of("Bad Gateway"), ex.getErrorMessages());
        assertEquals("request failed with status 502: Bad Gateway", ex.getMessage());
    }

    @Test
    void emptyBodyKeepsStatusOnly() {
        JiraApiException ex = ApiErrorDecoder.decode(response(401, ""));

        assertEquals(401, ex.getStatusCode());
        assertEquals("request failed with status 401", ex.getMessage());
    }

    private static JiraResponse response(int status, String body) {
        return new JiraResponse(status, "GET", "https://example.atlassian.net/rest/api/3/myself",
            body.getBytes(StandardCharsets.UTF_8));
    }
}
