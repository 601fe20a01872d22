package dev.atlassiansdk.jira.auth;

import java.util.Objects;

/**
 * Shared authentication state of a {@code JiraClient}.
 *
 * <p>
 * Every service of a client reads the credentials from the same instance on each request, so a call to one of the
 * setters is visible to all of them. Fields are volatile: a request in flight keeps the credentials it started with
 * and the next request picks up the new ones.
 * </p>
 */
public final class Authentication {

    private volatile Credentials credentials;
    private volatile String userAgent;

    public Authentication(Credentials credentials, String userAgent) {
        this.credentials = credentials == null ? AnonymousCredentials.INSTANCE : credentials;
        this.userAgent = userAgent;
    }

    public void setBasicAuth(String email, String apiToken) {
        this.credentials = new BasicCredentials(requireText(email, "email"), requireText(apiToken, "apiToken"));
    }

    public void setBearerToken(String token) {
        this.credentials = new BearerTokenCredentials(requireText(token, "token"));
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = requireText(userAgent, "userAgent");
    }

    /**
     * Drops the configured credentials; subsequent requests are sent anonymously.
     */
    public void clear() {
        this.credentials = AnonymousCredentials.INSTANCE;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public String getUserAgent() {
        return userAgent;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}
