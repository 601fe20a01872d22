package dev.atlassiansdk.jira.project;

import java.time.LocalDate;

/**
 * Project version as returned by the version endpoints.
 */
public record Version(
    String self,
    String id,
    String name,
    String description,
    Boolean archived,
    Boolean released,
    Boolean overdue,
    LocalDate startDate,
    LocalDate releaseDate,
    String userStartDate,
    String userReleaseDate,
    Long projectId,
    VersionIssuesStatus issuesStatusForFixVersion
) {
}
