package dev.atlassiansdk.jira;

import java.util.List;
import java.util.Map;

/**
 * Exception representing a non-2xx answer from Jira. The envelope is always attached, together with the
 * {@code errorMessages} and field {@code errors} Jira reports in its error body.
 */
public final class JiraApiException extends JiraException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final List<String> errorMessages;
    private final Map<String, String> errors;

    public JiraApiException(JiraResponse response, List<String> errorMessages, Map<String, String> errors) {
        super(describe(response.statusCode(), errorMessages, errors), null, response);
        this.statusCode = response.statusCode();
        this.errorMessages = errorMessages == null ? List.of() : List.copyOf(errorMessages);
        this.errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    /**
     * @return HTTP status code returned by Jira.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return top level messages from the error body (empty when Jira sent none).
     */
    public List<String> getErrorMessages() {
        return errorMessages;
    }

    /**
     * @return field name to message map from the error body.
     */
    public Map<String, String> getErrors() {
        return errors;
    }

    private static String describe(int status, List<String> errorMessages, Map<String, String> errors) {
        StringBuilder message = new StringBuilder("request failed with status ").append(status);
        if (errorMessages != null && !errorMessages.isEmpty()) {
            message.append(": ").append(String.join("; ", errorMessages));
        } else if (errors != null && !errors.isEmpty()) {
            message.append(": ").append(errors);
        }
        return message.toString();
    }
}
