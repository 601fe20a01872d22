package dev.atlassiansdk.jira.project;

import com.fasterxml.jackson.core.type.TypeReference;
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
 * Project version endpoints: listing, creation, update, merge, deletion and the issue counters of a version.
 */
public final class ProjectVersionService {

    private static final TypeReference<List<Version>> VERSION_LIST = new TypeReference<>() {
    };

    private final Transport transport;

    public ProjectVersionService(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns all versions of a project, unpaginated. Use {@link #search} for large projects.
     */
    public ApiResult<List<Version>> gets(String projectKeyOrId) throws JiraException {
        requireProject(projectKeyOrId);
        String endpoint = transport.api("project/" + Transport.segment(projectKeyOrId) + "/versions");
        HttpRequest request = transport.newRequest("GET", endpoint, null);
        return transport.call(request, VERSION_LIST);
    }

    /**
     * Returns one page of the versions of a project. {@code startAt} and {@code maxResults} are always sent; the
     * options only when set.
     *
     * @param options optional filters, may be {@code null}.
     */
    public ApiResult<VersionPage> search(String projectKeyOrId, VersionGetsOptions options, int startAt, int maxResults)
        throws JiraException {
        requireProject(projectKeyOrId);

        QueryString query = new QueryString()
            .add("startAt", startAt)
            .add("maxResults", maxResults);
        if (options != null) {
            query.addJoined("expand", options.expand())
                .add("query", options.query())
                .add("status", options.status())
                .add("orderBy", options.orderBy());
        }

        String endpoint = transport.api("project/" + Transport.segment(projectKeyOrId) + "/version");
        HttpRequest request = transport.newRequest("GET", query.appendTo(endpoint), null);
        return transport.call(request, VersionPage.class);
    }

    public ApiResult<Version> create(VersionPayload payload) throws JiraException {
        if (payload == null) {
            throw new JiraValidationException(JiraValidationException.NO_PAYLOAD);
        }
        HttpRequest request = transport.newRequest("POST", transport.api("version"), payload);
        return transport.call(request, Version.class);
    }

    /**
     * @param expand optional expansions such as {@code operations} or {@code issuesstatus}; may be {@code null}.
     */
    public ApiResult<Version> get(String versionId, List<String> expand) throws JiraException {
        requireVersion(versionId);
        String endpoint = new QueryString()
            .addJoined("expand", expand)
            .appendTo(versionPath(versionId));
        HttpRequest request = transport.newRequest("GET", endpoint, null);
        return transport.call(request, Version.class);
    }

    public ApiResult<Version> update(String versionId, VersionPayload payload) throws JiraException {
        requireVersion(versionId);
        if (payload == null) {
            throw new JiraValidationException(JiraValidationException.NO_PAYLOAD);
        }
        HttpRequest request = transport.newRequest("PUT", versionPath(versionId), payload);
        return transport.call(request, Version.class);
    }

    /**
     * Merges two versions: {@code versionId} is deleted and every fix version reference to it is replaced by
     * {@code moveIssuesTo}.
     */
    public JiraResponse merge(String versionId, String moveIssuesTo) throws JiraException {
        requireVersion(versionId);
        requireVersion(moveIssuesTo);
        String endpoint = versionPath(versionId) + "/mergeto/" + Transport.segment(moveIssuesTo);
        HttpRequest request = transport.newRequest("PUT", endpoint, null);
        return transport.call(request);
    }

    /**
     * Deletes a version. Issues using it as fix or affected version are moved to the given versions when set and
     * simply lose the reference otherwise.
     *
     * @param moveFixIssuesTo      replacement fix version, may be {@code null}.
     * @param moveAffectedIssuesTo replacement affected version, may be {@code null}.
     */
    public JiraResponse delete(String versionId, String moveFixIssuesTo, String moveAffectedIssuesTo)
        throws JiraException {
        requireVersion(versionId);
        String endpoint = new QueryString()
            .add("moveFixIssuesTo", moveFixIssuesTo)
            .add("moveAffectedIssuesTo", moveAffectedIssuesTo)
            .appendTo(versionPath(versionId));
        HttpRequest request = transport.newRequest("DELETE", endpoint, null);
        return transport.call(request);
    }

    public ApiResult<VersionIssueCounts> relatedIssueCounts(String versionId) throws JiraException {
        requireVersion(versionId);
        HttpRequest request = transport.newRequest("GET", versionPath(versionId) + "/relatedIssueCounts", null);
        return transport.call(request, VersionIssueCounts.class);
    }

    public ApiResult<VersionUnresolvedIssuesCount> unresolvedIssueCount(String versionId) throws JiraException {
        requireVersion(versionId);
        HttpRequest request = transport.newRequest("GET", versionPath(versionId) + "/unresolvedIssueCount", null);
        return transport.call(request, VersionUnresolvedIssuesCount.class);
    }

    private String versionPath(String versionId) {
        return transport.api("version/" + Transport.segment(versionId));
    }

    private static void requireProject(String projectKeyOrId) throws JiraValidationException {
        if (projectKeyOrId == null || projectKeyOrId.isBlank()) {
            throw new JiraValidationException(JiraValidationException.NO_PROJECT_ID);
        }
    }

    private static void requireVersion(String versionId) throws JiraValidationException {
        if (versionId == null || versionId.isBlank()) {
            throw new JiraValidationException(JiraValidationException.NO_VERSION_ID);
        }
    }
}
