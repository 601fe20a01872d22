package dev.atlassiansdk.jira;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Envelope describing a single HTTP exchange with Jira: the status code, the raw body bytes and the endpoint that
 * was invoked. Instances are created once per call and never reused.
 *
 * @param statusCode HTTP status returned by the server.
 * @param method     HTTP method used.
 * @param endpoint   absolute URL of the request, including its query string.
 * @param body       raw response body; empty when the server sent none. Copied on the way in and out.
 */
public record JiraResponse(int statusCode, String method, String endpoint, byte[] body) {

    public JiraResponse {
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof JiraResponse)) {
            return false;
        }
        JiraResponse that = (JiraResponse) other;
        return statusCode == that.statusCode
            && Objects.equals(method, that.method)
            && Objects.equals(endpoint, that.endpoint)
            && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(statusCode, method, endpoint) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "JiraResponse[" + method + " " + endpoint + " -> " + statusCode + ", " + body.length + " bytes]";
    }
}
