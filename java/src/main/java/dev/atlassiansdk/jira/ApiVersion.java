package dev.atlassiansdk.jira;

/**
 * Jira platform REST API generation targeted by the services.
 */
public enum ApiVersion {
    V2("rest/api/2"),
    V3("rest/api/3");

    private final String root;

    ApiVersion(String root) {
        this.root = root;
    }

    public String root() {
        return root;
    }
}
