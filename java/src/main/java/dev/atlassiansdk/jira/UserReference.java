package dev.atlassiansdk.jira;

/**
 * Compact user representation embedded in many Jira responses (watchers, owners, share targets).
 */
public record UserReference(
    String self,
    String accountId,
    String accountType,
    String displayName,
    Boolean active
) {
}
