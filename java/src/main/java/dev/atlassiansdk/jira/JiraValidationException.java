package dev.atlassiansdk.jira;

/**
 * Raised when a method argument fails local validation. No request is sent in that case.
 */
public final class JiraValidationException extends JiraException {

    private static final long serialVersionUID = 1L;

    public static final String NO_PROJECT_ID = "no project ID set";
    public static final String NO_VERSION_ID = "no version ID set";
    public static final String NO_ISSUE_KEY = "no issue key or ID set";
    public static final String NO_FILTER_ID = "no filter ID set";
    public static final String NO_PERMISSION_ID = "no share permission ID set";
    public static final String NO_DASHBOARD_ID = "no dashboard ID set";
    public static final String NO_PAYLOAD = "no payload set";

    public JiraValidationException(String message) {
        super(message);
    }
}
