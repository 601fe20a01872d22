package dev.atlassiansdk.jira.filter;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.atlassiansdk.jira.ApiResult;
import dev.atlassiansdk.jira.JiraException;
import dev.atlassiansdk.jira.JiraResponse;
import dev.atlassiansdk.jira.JiraValidationException;
import dev.atlassiansdk.jira.internal.Transport;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Objects;

/**
 * Filter sharing endpoints: the default share scope of the calling user and the share permissions of a filter.
 *
 * <p>
 * A filter can be shared with groups, projects, all logged-in users or the public. Sharing with all logged-in users
 * or the public is a global share permission.
 * </p>
 */
public final class FilterShareService {

    private static final TypeReference<List<SharePermission>> PERMISSION_LIST = new TypeReference<>() {
    };

    private final Transport transport;

    public FilterShareService(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns the default sharing settings for new filters and dashboards of the calling user.
     */
    public ApiResult<ShareFilterScope> scope() throws JiraException {
        HttpRequest request = transport.newRequest("GET", transport.api("filter/defaultShareScope"), null);
        return transport.call(request, ShareFilterScope.class);
    }

    /**
     * Sets the default sharing for new filters and dashboards of the calling user.
     *
     * @param scope {@code GLOBAL}, {@code AUTHENTICATED} or {@code PRIVATE}.
     * @throws JiraValidationException when the scope is not one of those values; nothing is sent.
     */
    public JiraResponse setScope(String scope) throws JiraException {
        return setScope(ShareScope.parse(scope));
    }

    public JiraResponse setScope(ShareScope scope) throws JiraException {
        if (scope == null) {
            throw new JiraValidationException("no scope set");
        }
        ShareFilterScope payload = new ShareFilterScope(scope.name());
        HttpRequest request = transport.newRequest("PUT", transport.api("filter/defaultShareScope"), payload);
        return transport.call(request);
    }

    /**
     * Returns the share permissions of a filter.
     */
    public ApiResult<List<SharePermission>> gets(long filterId) throws JiraException {
        requireFilterId(filterId);
        HttpRequest request = transport.newRequest("GET", permissionsPath(filterId), null);
        return transport.call(request, PERMISSION_LIST);
    }

    /**
     * Adds a share permission to a filter. A global share permission (all logged-in users or the public) replaces
     * every existing share permission of the filter.
     *
     * @return all share permissions of the filter after the change.
     */
    public ApiResult<List<SharePermission>> add(long filterId, PermissionFilterPayload payload) throws JiraException {
        requireFilterId(filterId);
        if (payload == null) {
            throw new JiraValidationException(JiraValidationException.NO_PAYLOAD);
        }
        HttpRequest request = transport.newRequest("POST", permissionsPath(filterId), payload);
        return transport.call(request, PERMISSION_LIST);
    }

    public ApiResult<SharePermission> get(long filterId, long permissionId) throws JiraException {
        requireFilterId(filterId);
        requirePermissionId(permissionId);
        HttpRequest request = transport.newRequest("GET", permissionPath(filterId, permissionId), null);
        return transport.call(request, SharePermission.class);
    }

    public JiraResponse delete(long filterId, long permissionId) throws JiraException {
        requireFilterId(filterId);
        requirePermissionId(permissionId);
        HttpRequest request = transport.newRequest("DELETE", permissionPath(filterId, permissionId), null);
        return transport.call(request);
    }

    private String permissionsPath(long filterId) {
        return transport.api("filter/" + filterId + "/permission");
    }

    private String permissionPath(long filterId, long permissionId) {
        return permissionsPath(filterId) + "/" + permissionId;
    }

    private static void requireFilterId(long filterId) throws JiraValidationException {
        if (filterId <= 0) {
            throw new JiraValidationException(JiraValidationException.NO_FILTER_ID);
        }
    }

    private static void requirePermissionId(long permissionId) throws JiraValidationException {
        if (permissionId <= 0) {
            throw new JiraValidationException(JiraValidationException.NO_PERMISSION_ID);
        }
    }
}
