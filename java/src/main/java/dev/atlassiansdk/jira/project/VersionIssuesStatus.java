package dev.atlassiansdk.jira.project;

/**
 * Issue counts per status category for a fix version; present when requested with the
 * {@code issuesstatus} expand.
 */
public record VersionIssuesStatus(Integer unmapped, Integer toDo, Integer inProgress, Integer done) {
}
