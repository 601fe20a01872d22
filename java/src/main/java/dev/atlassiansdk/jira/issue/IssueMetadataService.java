package dev.atlassiansdk.jira.issue;

import com.fasterxml.jackson.databind.JsonNode;
import dev.atlassiansdk.jira.ApiResult;
import dev.atlassiansdk.jira.JiraException;
import dev.atlassiansdk.jira.JiraValidationException;
import dev.atlassiansdk.jira.internal.QueryString;
import dev.atlassiansdk.jira.internal.Transport;

import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * Create and edit screen metadata.
 *
 * <p>
 * The field layout of these responses depends on each site's project, issue type and screen configuration, so they
 * are returned as a {@link JsonNode} tree rather than a fixed model.
 * </p>
 */
public final class IssueMetadataService {

    private final Transport transport;

    public IssueMetadataService(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns the edit screen fields of an issue that are visible to and editable by the calling user.
     *
     * @param overrideScreenSecurity include fields hidden from the screen (requires admin permission).
     * @param overrideEditableFlag   include fields that are not editable in the issue's current status.
     */
    public ApiResult<JsonNode> get(String issueKeyOrId, boolean overrideScreenSecurity, boolean overrideEditableFlag)
        throws JiraException {
        if (issueKeyOrId == null || issueKeyOrId.isBlank()) {
            throw new JiraValidationException(JiraValidationException.NO_ISSUE_KEY);
        }

        String endpoint = new QueryString()
            .flag("overrideScreenSecurity", overrideScreenSecurity)
            .flag("overrideEditableFlag", overrideEditableFlag)
            .appendTo(transport.api("issue/" + Transport.segment(issueKeyOrId) + "/editmeta"));

        HttpRequest request = transport.newRequest("GET", endpoint, null);
        return transport.callTree(request);
    }

    /**
     * Returns the projects and issue types the calling user can create issues in and, with
     * {@code expand=projects.issuetypes.fields}, the create screen fields of each issue type.
     *
     * @param options optional filters, may be {@code null} for every project.
     */
    public ApiResult<JsonNode> create(IssueMetadataCreateOptions options) throws JiraException {
        QueryString query = new QueryString();
        if (options != null) {
            query.addEach("projectIds", options.projectIds())
                .addEach("projectKeys", options.projectKeys())
                .addEach("issuetypeIds", options.issueTypeIds())
                .addEach("issuetypeNames", options.issueTypeNames())
                .add("expand", options.expand());
        }

        HttpRequest request = transport.newRequest("GET", query.appendTo(transport.api("issue/createmeta")), null);
        return transport.callTree(request);
    }
}
