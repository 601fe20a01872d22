package dev.atlassiansdk.jira.dashboard;

import java.util.List;

/**
 * One page of dashboards. {@code prev} and {@code next} hold the URLs of the neighbouring pages when they exist.
 */
public record DashboardPage(
    Integer startAt,
    Integer maxResults,
    Integer total,
    String prev,
    String next,
    List<Dashboard> dashboards
) {
}
