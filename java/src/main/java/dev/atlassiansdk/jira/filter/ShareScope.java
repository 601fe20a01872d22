package dev.atlassiansdk.jira.filter;

import dev.atlassiansdk.jira.JiraValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Default visibility applied to new filters and dashboards.
 */
public enum ShareScope {
    GLOBAL,
    AUTHENTICATED,
    PRIVATE;

    /**
     * Resolves the exact (case sensitive) scope name.
     *
     * @throws JiraValidationException when {@code value} is not one of the supported scopes.
     */
    public static ShareScope parse(String value) throws JiraValidationException {
        if (value != null) {
            for (ShareScope scope : values()) {
                if (scope.name().equals(value)) {
                    return scope;
                }
            }
        }
        String allowed = Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(","));
        throw new JiraValidationException("invalid scope, please provide one of the following: " + allowed);
    }
}
