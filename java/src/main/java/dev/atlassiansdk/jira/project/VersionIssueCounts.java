package dev.atlassiansdk.jira.project;

import java.util.List;

/**
 * Issues referencing a version as fix version, as affected version, or through a version custom field.
 */
public record VersionIssueCounts(
    String self,
    Integer issuesFixedCount,
    Integer issuesAffectedCount,
    Integer issueCountWithCustomFieldsShowingVersion,
    List<CustomFieldUsage> customFieldUsage
) {

    public record CustomFieldUsage(String fieldName, Long customFieldId, Integer issueCountWithVersionInCustomField) {
    }
}
