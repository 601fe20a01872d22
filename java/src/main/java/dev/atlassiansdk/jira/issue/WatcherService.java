package dev.atlassiansdk.jira.issue;

import dev.atlassiansdk.jira.ApiResult;
import dev.atlassiansdk.jira.JiraException;
import dev.atlassiansdk.jira.JiraResponse;
import dev.atlassiansdk.jira.JiraValidationException;
import dev.atlassiansdk.jira.internal.QueryString;
import dev.atlassiansdk.jira.internal.Transport;

import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * Issue watcher endpoints.
 */
public final class WatcherService {

    private final Transport transport;

    public WatcherService(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public ApiResult<IssueWatchers> get(String issueKeyOrId) throws JiraException {
        HttpRequest request = transport.newRequest("GET", watchersPath(issueKeyOrId), null);
        return transport.call(request, IssueWatchers.class);
    }

    /**
     * Adds the calling user as a watcher.
     */
    public JiraResponse add(String issueKeyOrId) throws JiraException {
        HttpRequest request = transport.newRequest("POST", watchersPath(issueKeyOrId), null);
        return transport.call(request);
    }

    /**
     * Adds the given user as a watcher. Jira expects the account ID as a bare JSON string body.
     */
    public JiraResponse add(String issueKeyOrId, String accountId) throws JiraException {
        String endpoint = watchersPath(issueKeyOrId);
        if (accountId == null || accountId.isBlank()) {
            return add(issueKeyOrId);
        }
        HttpRequest request = transport.newRequest("POST", endpoint, accountId);
        return transport.call(request);
    }

    /**
     * Removes the calling user from the watchers.
     */
    public JiraResponse delete(String issueKeyOrId) throws JiraException {
        return delete(issueKeyOrId, null);
    }

    /**
     * Removes the given user from the watchers; {@code accountId} is only sent when set.
     */
    public JiraResponse delete(String issueKeyOrId, String accountId) throws JiraException {
        String endpoint = new QueryString()
            .add("accountId", accountId)
            .appendTo(watchersPath(issueKeyOrId));
        HttpRequest request = transport.newRequest("DELETE", endpoint, null);
        return transport.call(request);
    }

    private String watchersPath(String issueKeyOrId) throws JiraValidationException {
        if (issueKeyOrId == null || issueKeyOrId.isBlank()) {
            throw new JiraValidationException(JiraValidationException.NO_ISSUE_KEY);
        }
        return transport.api("issue/" + Transport.segment(issueKeyOrId) + "/watchers");
    }
}
