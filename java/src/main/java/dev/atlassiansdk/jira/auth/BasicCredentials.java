package dev.atlassiansdk.jira.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP Basic credentials made of an Atlassian account e-mail and an API token.
 */
public final class BasicCredentials implements Credentials {

    private final String email;
    private final String header;

    public BasicCredentials(String email, String apiToken) {
        this.email = Objects.requireNonNull(email, "email");
        Objects.requireNonNull(apiToken, "apiToken");
        String pair = email + ":" + apiToken;
        this.header = "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    public String getEmail() {
        return email;
    }

    @Override
    public String authorizationHeader() {
        return header;
    }

    @Override
    public String toString() {
        return "BasicCredentials[" + email + "]";
    }
}
