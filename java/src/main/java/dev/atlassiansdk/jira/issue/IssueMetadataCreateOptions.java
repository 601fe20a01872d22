package dev.atlassiansdk.jira.issue;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Narrows the create metadata response. Each list element is sent as its own query parameter; null or blank
 * elements, empty lists and a blank {@code expand} are not sent.
 */
public record IssueMetadataCreateOptions(
    List<String> projectIds,
    List<String> projectKeys,
    List<String> issueTypeIds,
    List<String> issueTypeNames,
    String expand
) {

    public IssueMetadataCreateOptions {
        projectIds = present(projectIds);
        projectKeys = present(projectKeys);
        issueTypeIds = present(issueTypeIds);
        issueTypeNames = present(issueTypeNames);
    }

    private static List<String> present(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .filter(value -> !value.isBlank())
            .toList();
    }

    public static IssueMetadataCreateOptions forProjectKeys(String... projectKeys) {
        return new IssueMetadataCreateOptions(null, Arrays.asList(projectKeys), null, null, null);
    }

    public IssueMetadataCreateOptions withExpand(String expand) {
        return new IssueMetadataCreateOptions(projectIds, projectKeys, issueTypeIds, issueTypeNames, expand);
    }
}
