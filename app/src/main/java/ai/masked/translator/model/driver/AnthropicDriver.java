package ai.masked.translator.model.driver;

import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Anthropic through its OpenAI-compatible chat completions endpoint. Errors arrive as a
 * structured envelope even on 4xx/5xx, so the registry enables {@code http_error_handling}.
 */
public final class AnthropicDriver extends ChatCompletionsDriver {

    public static final String VENDOR = "anthropic";

    static final int DEFAULT_MAX_TOKENS = 1000;

    public AnthropicDriver(PromptCatalog prompts, ObjectMapper objectMapper) {
        super(prompts, objectMapper, "Anthropic");
    }

    @Override
    protected void customizePayload(ObjectNode payload, ModelConfig config) {
        payload.put("max_tokens", config.defaultInt("max_tokens").orElse(DEFAULT_MAX_TOKENS));
    }

    @Override
    protected void raiseVendorError(JsonNode root, String rawBody) {
        JsonNode error = root.get("error");
        if (error == null || !error.isObject()) {
            return;
        }
        JsonNode messageNode = error.get("message");
        String message = messageNode != null && messageNode.isTextual() ? messageNode.asText() : error.toString();
        if (message.contains("max_tokens")) {
            throw new VendorApiException("Requested max_tokens exceeds model limit. "
                    + "Please reduce to at most the allowed number. Response: " + message, rawBody);
        }
        throw new VendorApiException("Anthropic API error: " + message, rawBody);
    }
}
