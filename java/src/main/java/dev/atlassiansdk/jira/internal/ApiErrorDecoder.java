package dev.atlassiansdk.jira.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.atlassiansdk.jira.JiraApiException;
import dev.atlassiansdk.jira.JiraResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a non-2xx envelope into a {@link JiraApiException}.
 *
 * <p>
 * Jira reports failures as {@code {"errorMessages":["..."],"errors":{"field":"..."}}}. Bodies that are not JSON
 * (proxies, HTML error pages) are kept verbatim as the single error message.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static JiraApiException decode(JiraResponse response) {
        byte[] bytes = response.body();
        if (bytes.length == 0) {
            return new JiraApiException(response, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            if (node == null || !node.isObject()) {
                return new JiraApiException(response, List.of(response.bodyAsString()), null);
            }

            List<String> messages = new ArrayList<>();
            JsonNode messagesNode = node.path("errorMessages");
            if (messagesNode.isArray()) {
                messagesNode.forEach(item -> {
                    if (!item.asText().isBlank()) {
                        messages.add(item.asText());
                    }
                });
            }
            if (messages.isEmpty() && node.hasNonNull("message")) {
                messages.add(node.get("message").asText());
            }

            Map<String, String> errors = new LinkedHashMap<>();
            JsonNode errorsNode = node.path("errors");
            if (errorsNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = errorsNode.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    errors.put(field.getKey(), field.getValue().asText());
                }
            }
            return new JiraApiException(response, messages, errors);
        } catch (IOException ex) {
            return new JiraApiException(response, List.of(response.bodyAsString()), null);
        }
    }
}
