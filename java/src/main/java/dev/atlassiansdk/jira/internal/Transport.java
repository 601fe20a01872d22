package dev.atlassiansdk.jira.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import dev.atlassiansdk.jira.ApiResult;
import dev.atlassiansdk.jira.Config;
import dev.atlassiansdk.jira.JiraException;
import dev.atlassiansdk.jira.JiraResponse;
import dev.atlassiansdk.jira.auth.Authentication;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Request/response plumbing shared by every service of a client.
 *
 * <p>
 * {@link #newRequest(String, String, Object)} resolves a relative endpoint against the configured host and attaches
 * the default headers; {@link #call(HttpRequest)} performs exactly one round trip and captures the envelope. The
 * authentication holder is read on every request, never copied.
 * </p>
 */
public final class Transport {

    private static final Logger LOGGER = Logger.getLogger(Transport.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiRoot;
    private final Authentication authentication;

    public Transport(Config config, Authentication authentication) {
        Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(config.getHttpClient(), "httpClient");
        this.baseUrl = Objects.requireNonNull(config.getBaseUrl(), "baseUrl");
        this.apiRoot = config.getApiVersion().root();
        this.authentication = Objects.requireNonNull(authentication, "authentication");
    }

    /**
     * @return {@code path} prefixed with the REST API root, for example {@code rest/api/3/filter/10/permission}.
     */
    public String api(String path) {
        return apiRoot + "/" + path;
    }

    /**
     * Builds a request against {@code baseUrl/endpoint}.
     *
     * @param method   HTTP method.
     * @param endpoint path relative to the host, optionally with a query string.
     * @param payload  object serialised as the JSON body, or {@code null} for no body.
     * @throws JiraException when the endpoint is not a valid URI or the payload cannot be serialised.
     */
    public HttpRequest newRequest(String method, String endpoint, Object payload) throws JiraException {
        URI uri;
        try {
            uri = URI.create(baseUrl + "/" + endpoint);
        } catch (IllegalArgumentException ex) {
            throw new JiraException("invalid endpoint " + endpoint + ": " + ex.getMessage(), ex);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body;
            try {
                body = Json.mapper().writeValueAsBytes(payload);
            } catch (JsonProcessingException ex) {
                throw new JiraException("encode request payload: " + ex.getOriginalMessage(), ex);
            }
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        builder.header("Accept", "application/json");

        String userAgent = authentication.getUserAgent();
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }

        String authorization = authentication.getCredentials().authorizationHeader();
        if (authorization != null && !authorization.isBlank()) {
            builder.header("Authorization", authorization);
        }

        return builder.build();
    }

    /**
     * Sends the request and captures the envelope.
     *
     * @throws JiraException when the transport fails or the call is interrupted.
     * @throws dev.atlassiansdk.jira.JiraApiException when Jira answers with a non-2xx status.
     */
    public JiraResponse call(HttpRequest request) throws JiraException {
        String method = request.method();
        String endpoint = request.uri().toString();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[jira-sdk] %s %s", method, endpoint));

        HttpResponse<byte[]> httpResponse;
        try {
            httpResponse = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new JiraException(method + " " + endpoint + " interrupted", ex);
        } catch (IOException ex) {
            throw new JiraException(method + " " + endpoint + ": " + ex.getMessage(), ex);
        }

        JiraResponse response = new JiraResponse(httpResponse.statusCode(), method, endpoint, httpResponse.body());
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[jira-sdk] %s %s returned %d (%d bytes)", method, endpoint, response.statusCode(), response.body().length));

        if (!response.isSuccessful()) {
            throw ApiErrorDecoder.decode(response);
        }
        return response;
    }

    /**
     * Sends the request and decodes the JSON body into {@code type}. The result is {@code null} when the body is empty.
     */
    public <T> ApiResult<T> call(HttpRequest request, Class<T> type) throws JiraException {
        JiraResponse response = call(request);
        if (response.body().length == 0) {
            return new ApiResult<>(null, response);
        }
        try {
            return new ApiResult<>(Json.mapper().readValue(response.body(), type), response);
        } catch (IOException ex) {
            throw decodeFailure(type.getSimpleName(), ex, response);
        }
    }

    public <T> ApiResult<T> call(HttpRequest request, TypeReference<T> type) throws JiraException {
        JiraResponse response = call(request);
        if (response.body().length == 0) {
            return new ApiResult<>(null, response);
        }
        try {
            return new ApiResult<>(Json.mapper().readValue(response.body(), type), response);
        } catch (IOException ex) {
            throw decodeFailure(type.getType().getTypeName(), ex, response);
        }
    }

    /**
     * Sends the request and parses the body as an untyped tree. An empty body yields a missing node.
     */
    public ApiResult<JsonNode> callTree(HttpRequest request) throws JiraException {
        JiraResponse response = call(request);
        try {
            return new ApiResult<>(Json.mapper().readTree(response.body()), response);
        } catch (IOException ex) {
            throw decodeFailure("JSON tree", ex, response);
        }
    }

    /**
     * Percent-encodes a value for use as a single path segment.
     */
    public static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static JiraException decodeFailure(String target, IOException ex, JiraResponse response) {
        return new JiraException("decode " + target + " response: " + ex.getMessage(), ex, response);
    }
}
