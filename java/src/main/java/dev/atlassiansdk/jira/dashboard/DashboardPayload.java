package dev.atlassiansdk.jira.dashboard;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.atlassiansdk.jira.filter.SharePermission;

import java.util.List;

/**
 * Body of the create, update and copy dashboard calls. Jira requires the share and edit permission lists to be
 * present, so they are always sent, empty when not given.
 */
public record DashboardPayload(
    String name,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) String description,
    List<SharePermission> sharePermissions,
    List<SharePermission> editPermissions
) {

    public DashboardPayload {
        sharePermissions = sharePermissions == null ? List.of() : List.copyOf(sharePermissions);
        editPermissions = editPermissions == null ? List.of() : List.copyOf(editPermissions);
    }

    public static DashboardPayload named(String name, String description) {
        return new DashboardPayload(name, description, null, null);
    }
}
