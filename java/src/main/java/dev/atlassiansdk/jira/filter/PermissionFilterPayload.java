package dev.atlassiansdk.jira.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Share permission to add to a filter. Empty fields are left out of the request body.
 *
 * @param type          one of {@code group}, {@code project}, {@code projectRole}, {@code user},
 *                      {@code authenticated} or {@code global}.
 * @param projectId     target project for {@code project} and {@code projectRole} shares.
 * @param groupName     target group for {@code group} shares.
 * @param projectRoleId role within {@code projectId} for {@code projectRole} shares.
 * @param accountId     target user for {@code user} shares.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PermissionFilterPayload(
    String type,
    String projectId,
    @JsonProperty("groupname") String groupName,
    String projectRoleId,
    String accountId
) {

    public static PermissionFilterPayload group(String groupName) {
        return new PermissionFilterPayload("group", null, groupName, null, null);
    }

    public static PermissionFilterPayload project(String projectId) {
        return new PermissionFilterPayload("project", projectId, null, null, null);
    }

    public static PermissionFilterPayload projectRole(String projectId, String projectRoleId) {
        return new PermissionFilterPayload("projectRole", projectId, null, projectRoleId, null);
    }

    public static PermissionFilterPayload user(String accountId) {
        return new PermissionFilterPayload("user", null, null, null, accountId);
    }
}
