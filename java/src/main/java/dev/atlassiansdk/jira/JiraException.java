package dev.atlassiansdk.jira;

import java.util.Optional;

/**
 * Base exception thrown by the Jira Cloud Java SDK.
 *
 * <p>
 * Transport failures carry the underlying {@link java.io.IOException} as their cause and no response. Decode failures
 * and remote API errors carry the {@link JiraResponse} envelope so callers can inspect the status code and raw body.
 * </p>
 */
public class JiraException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient JiraResponse response;

    public JiraException(String message) {
        this(message, null, null);
    }

    public JiraException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public JiraException(String message, Throwable cause, JiraResponse response) {
        super(message, cause);
        this.response = response;
    }

    /**
     * @return the envelope of the call that failed, or empty when the failure happened before a response arrived.
     */
    public Optional<JiraResponse> response() {
        return Optional.ofNullable(response);
    }
}
