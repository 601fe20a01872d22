package dev.atlassiansdk.jira.issue;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.atlassiansdk.jira.UserReference;

import java.util.List;

/**
 * Watchers of an issue and whether the calling user is one of them.
 */
public record IssueWatchers(
    String self,
    @JsonProperty("isWatching") Boolean watching,
    Integer watchCount,
    List<UserReference> watchers
) {
}
