package dev.atlassiansdk.jira.filter;

import dev.atlassiansdk.jira.UserReference;

/**
 * Rule granting visibility of a filter or dashboard to a group, a project (optionally a project role), a single user,
 * all logged-in users ({@code authenticated}) or everybody ({@code global}).
 */
public record SharePermission(
    Long id,
    String type,
    Project project,
    Role role,
    Group group,
    UserReference user
) {

    public record Project(String id, String key, String name, String self) {
    }

    public record Role(Long id, String name, String self) {
    }

    public record Group(String groupId, String name, String self) {
    }
}
