package ai.masked.translator.model.driver;

import ai.masked.translator.translate.ConfigurationException;
import ai.masked.translator.translate.MalformedResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/**
 * Jackson helpers shared by drivers.
 */
final class JsonBodies {

    private JsonBodies() {
    }

    static JsonNode read(ObjectMapper objectMapper, String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new MalformedResponseException("Empty response body", rawBody);
        }
        try {
            JsonNode root = objectMapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                throw new MalformedResponseException("Invalid JSON response: expected an object", rawBody);
            }
            return root;
        } catch (JsonProcessingException ex) {
            throw new MalformedResponseException("Invalid JSON response: " + ex.getOriginalMessage(), rawBody, ex);
        }
    }

    static String write(ObjectMapper objectMapper, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Failed to serialize request payload", ex);
        }
    }

    static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    static Optional<JsonNode> object(JsonNode node) {
        return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    }
}
