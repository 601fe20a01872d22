package dev.atlassiansdk.jira;

/**
 * Decoded value returned together with the envelope it was read from.
 *
 * @param result   decoded body; {@code null} when the server answered without content.
 * @param response envelope of the call.
 * @param <T>      type of the decoded body.
 */
public record ApiResult<T>(T result, JiraResponse response) {
}
