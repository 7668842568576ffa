package ai.masked.translator.model.driver;

import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.TruncatedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Vendors speaking the OpenAI chat completions shape:
 * {@code choices[0].message.content}, {@code choices[0].finish_reason} and {@code usage}.
 */
abstract class ChatCompletionsDriver extends MarkerChatDriver {

    ChatCompletionsDriver(PromptCatalog prompts, ObjectMapper objectMapper, String vendorLabel) {
        super(prompts, objectMapper, vendorLabel);
    }

    @Override
    protected ObjectNode buildPayload(ModelConfig config, String systemPrompt, String userContent, DriverOptions options) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", requireModelName(config));
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userContent);
        payload.put("temperature", config.defaultDouble("temperature", 0.0));
        customizePayload(payload, config);
        return payload;
    }

    protected void customizePayload(ObjectNode payload, ModelConfig config) {
    }

    @Override
    protected Optional<String> extractContent(JsonNode root) {
        return JsonBodies.text(firstChoice(root).path("message").get("content"));
    }

    @Override
    protected void checkCompletion(JsonNode root, String rawBody) {
        if ("length".equals(firstChoice(root).path("finish_reason").asText(null))) {
            throw new TruncatedResponseException(vendorLabel()
                    + ": translation was truncated (finish_reason=length); increase max_tokens or split the input", rawBody);
        }
    }

    @Override
    protected Optional<JsonNode> extractUsage(JsonNode root) {
        return JsonBodies.object(root.get("usage"));
    }

    private static JsonNode firstChoice(JsonNode root) {
        return root.path("choices").path(0);
    }
}
