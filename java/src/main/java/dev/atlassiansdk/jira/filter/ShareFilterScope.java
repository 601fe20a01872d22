package dev.atlassiansdk.jira.filter;

/**
 * Body of the default share scope endpoint, used both ways.
 */
public record ShareFilterScope(String scope) {
}
