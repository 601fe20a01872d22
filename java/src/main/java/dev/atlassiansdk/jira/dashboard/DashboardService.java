package dev.atlassiansdk.jira.dashboard;

import dev.atlassiansdk.jira.ApiResult;
import dev.atlassiansdk.jira.JiraException;
import dev.atlassiansdk.jira.JiraResponse;
import dev.atlassiansdk.jira.JiraValidationException;
import dev.atlassiansdk.jira.internal.QueryString;
import dev.atlassiansdk.jira.internal.Transport;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Objects;

/**
 * Dashboard endpoints.
 */
public final class DashboardService {

    static final List<String> FILTERS = List.of("my", "favourite");

    private final Transport transport;

    public DashboardService(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns a page of the dashboards visible to the calling user.
     *
     * @param filter empty for all dashboards, {@code my} for owned ones or {@code favourite} for favourites.
     * @throws JiraValidationException when {@code filter} is not one of those values.
     */
    public ApiResult<DashboardPage> gets(int startAt, int maxResults, String filter) throws JiraException {
        if (filter != null && !filter.isEmpty() && !FILTERS.contains(filter)) {
            throw new JiraValidationException(
                "invalid dashboard filter, please provide one of the following: " + String.join(",", FILTERS));
        }

        String endpoint = new QueryString()
            .add("startAt", startAt)
            .add("maxResults", maxResults)
            .add("filter", filter)
            .appendTo(transport.api("dashboard"));
        HttpRequest request = transport.newRequest("GET", endpoint, null);
        return transport.call(request, DashboardPage.class);
    }

    public ApiResult<Dashboard> get(String dashboardId) throws JiraException {
        HttpRequest request = transport.newRequest("GET", dashboardPath(dashboardId), null);
        return transport.call(request, Dashboard.class);
    }

    public ApiResult<Dashboard> create(DashboardPayload payload) throws JiraException {
        requirePayload(payload);
        HttpRequest request = transport.newRequest("POST", transport.api("dashboard"), payload);
        return transport.call(request, Dashboard.class);
    }

    public ApiResult<Dashboard> update(String dashboardId, DashboardPayload payload) throws JiraException {
        String endpoint = dashboardPath(dashboardId);
        requirePayload(payload);
        HttpRequest request = transport.newRequest("PUT", endpoint, payload);
        return transport.call(request, Dashboard.class);
    }

    /**
     * Copies a dashboard; the payload supplies the name and permissions of the copy.
     */
    public ApiResult<Dashboard> copy(String dashboardId, DashboardPayload payload) throws JiraException {
        String endpoint = dashboardPath(dashboardId) + "/copy";
        requirePayload(payload);
        HttpRequest request = transport.newRequest("POST", endpoint, payload);
        return transport.call(request, Dashboard.class);
    }

    public JiraResponse delete(String dashboardId) throws JiraException {
        HttpRequest request = transport.newRequest("DELETE", dashboardPath(dashboardId), null);
        return transport.call(request);
    }

    private String dashboardPath(String dashboardId) throws JiraValidationException {
        if (dashboardId == null || dashboardId.isBlank()) {
            throw new JiraValidationException(JiraValidationException.NO_DASHBOARD_ID);
        }
        return transport.api("dashboard/" + Transport.segment(dashboardId));
    }

    private static void requirePayload(DashboardPayload payload) throws JiraValidationException {
        if (payload == null) {
            throw new JiraValidationException(JiraValidationException.NO_PAYLOAD);
        }
        if (payload.name() == null || payload.name().isBlank()) {
            throw new JiraValidationException("dashboard name is required");
        }
    }
}
