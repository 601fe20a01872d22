package dev.atlassiansdk.jira.auth;

import java.util.Objects;

/**
 * Bearer token credentials (OAuth 2.0 access token or personal access token).
 */
public final class BearerTokenCredentials implements Credentials {

    private final String token;

    public BearerTokenCredentials(String token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public String authorizationHeader() {
        return "Bearer " + token;
    }

    @Override
    public String toString() {
        return "BearerTokenCredentials[****]";
    }
}
