package dev.atlassiansdk.jira.auth;

/**
 * Credentials used when no authentication has been configured.
 */
public final class AnonymousCredentials implements Credentials {

    public static final AnonymousCredentials INSTANCE = new AnonymousCredentials();

    private AnonymousCredentials() {
    }

    @Override
    public String authorizationHeader() {
        return null;
    }
}
