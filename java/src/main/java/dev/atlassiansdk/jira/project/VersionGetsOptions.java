package dev.atlassiansdk.jira.project;

import java.util.List;
import java.util.Objects;

/**
 * Optional filters of the paginated version search. {@code null} or empty values, including blank
 * {@code expand} entries, are not sent.
 *
 * @param expand  extra data to include, e.g. {@code issuesstatus} or {@code operations}.
 * @param query   case insensitive match against the version name and description.
 * @param status  comma separated list of {@code released}, {@code unreleased}, {@code archived}.
 * @param orderBy field to sort by, optionally prefixed with {@code -} or {@code +}.
 */
public record VersionGetsOptions(List<String> expand, String query, String status, String orderBy) {

    public VersionGetsOptions {
        expand = expand == null ? List.of() : expand.stream()
            .filter(Objects::nonNull)
            .filter(value -> !value.isBlank())
            .toList();
    }
}
