package dev.atlassiansdk.jira.dashboard;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.atlassiansdk.jira.UserReference;
import dev.atlassiansdk.jira.filter.SharePermission;

import java.util.List;

public record Dashboard(
    String id,
    String self,
    String name,
    String description,
    @JsonProperty("isFavourite") Boolean favourite,
    @JsonProperty("isWritable") Boolean writable,
    Boolean systemDashboard,
    UserReference owner,
    Integer popularity,
    Integer rank,
    String view,
    List<SharePermission> sharePermissions,
    List<SharePermission> editPermissions
) {
}
