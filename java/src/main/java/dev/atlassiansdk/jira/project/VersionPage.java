package dev.atlassiansdk.jira.project;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of project versions.
 */
public record VersionPage(
    String self,
    String nextPage,
    Integer maxResults,
    Integer startAt,
    Integer total,
    @JsonProperty("isLast") Boolean last,
    List<Version> values
) {
}
