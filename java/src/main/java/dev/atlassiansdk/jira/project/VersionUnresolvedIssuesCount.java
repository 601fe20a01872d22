package dev.atlassiansdk.jira.project;

public record VersionUnresolvedIssuesCount(String self, Integer issuesUnresolvedCount, Integer issuesCount) {
}
