package dev.atlassiansdk.jira;

import dev.atlassiansdk.jira.auth.AnonymousCredentials;
import dev.atlassiansdk.jira.auth.BasicCredentials;
import dev.atlassiansdk.jira.auth.BearerTokenCredentials;
import dev.atlassiansdk.jira.auth.Credentials;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link JiraClient} instances.
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "jira-cloud-sdk-java/0.3.0";
    public static final ApiVersion DEFAULT_API_VERSION = ApiVersion.V3;

    static final String ENV_HOST = "HOST";
    static final String ENV_MAIL = "MAIL";
    static final String ENV_TOKEN = "TOKEN";
    static final String ENV_USER_AGENT = "USER_AGENT";

    private final String baseUrl;
    private final ApiVersion apiVersion;
    private final Credentials credentials;
    private final String userAgent;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiVersion = builder.apiVersion;
        this.credentials = builder.credentials;
        this.userAgent = builder.userAgent;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from environment style variables: {@code HOST} is required, {@code MAIL} and
     * {@code TOKEN} select basic authentication, {@code TOKEN} alone selects a bearer token and {@code USER_AGENT}
     * overrides the default agent.
     *
     * @param env variables to read, usually {@link System#getenv()}.
     * @return a validated configuration.
     * @throws IllegalArgumentException when {@code HOST} is missing or invalid.
     */
    public static Config fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String host = trimToNull(env.get(ENV_HOST));
        if (host == null) {
            throw new IllegalArgumentException(ENV_HOST + " is required");
        }
        String mail = trimToNull(env.get(ENV_MAIL));
        String token = trimToNull(env.get(ENV_TOKEN));

        Builder builder = builder().baseUrl(host).userAgent(trimToNull(env.get(ENV_USER_AGENT)));
        if (token != null && mail != null) {
            builder.basicAuth(mail, token);
        } else if (token != null) {
            builder.bearerToken(token);
        }
        return builder.build();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(baseUrl);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_USER_AGENT);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .apiVersion(Optional.ofNullable(apiVersion).orElse(DEFAULT_API_VERSION))
            .credentials(Optional.ofNullable(credentials).orElse(AnonymousCredentials.INSTANCE))
            .userAgent(resolvedAgent)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("BaseURL is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("BaseURL must include scheme and host");
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new IllegalArgumentException("BaseURL must use http or https: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid BaseURL: " + trimmed, ex);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ApiVersion getApiVersion() {
        return apiVersion;
    }

    /**
     * @return credentials the client starts with; later changes go through {@link JiraClient#authentication()}.
     */
    public Credentials getCredentials() {
        return credentials;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private String baseUrl;
        private ApiVersion apiVersion;
        private Credentials credentials;
        private String userAgent;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiVersion(ApiVersion apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder basicAuth(String email, String apiToken) {
            this.credentials = new BasicCredentials(email, apiToken);
            return this;
        }

        public Builder bearerToken(String token) {
            this.credentials = new BearerTokenCredentials(token);
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Supplies the transport. When omitted the SDK creates one using {@link #httpTimeout(Duration)} as the
         * connect timeout.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
