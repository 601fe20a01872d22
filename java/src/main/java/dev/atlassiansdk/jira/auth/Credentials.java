package dev.atlassiansdk.jira.auth;

/**
 * Contract for producing the {@code Authorization} header attached to every request.
 */
public interface Credentials {

    /**
     * @return the full header value, or {@code null} when requests should go out unauthenticated.
     */
    String authorizationHeader();
}
