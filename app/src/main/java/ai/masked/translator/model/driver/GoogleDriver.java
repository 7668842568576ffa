package ai.masked.translator.model.driver;

import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.MalformedResponseException;
import ai.masked.translator.translate.TruncatedResponseException;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Google Gemini {@code generateContent}. The model is part of the endpoint URL, so no model
 * name is required in the defaults.
 */
public final class GoogleDriver extends MarkerChatDriver {

    public static final String VENDOR = "google";

    public GoogleDriver(PromptCatalog prompts, ObjectMapper objectMapper) {
        super(prompts, objectMapper, "Gemini");
    }

    @Override
    protected ObjectNode buildPayload(ModelConfig config, String systemPrompt, String userContent, DriverOptions options) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putObject("system_instruction").putArray("parts").addObject().put("text", systemPrompt);
        payload.putArray("contents").addObject().putArray("parts").addObject().put("text", userContent);

        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", config.defaultDouble("temperature", 0.0));
        generationConfig.put("candidateCount", config.defaultInt("candidateCount").orElse(1));
        config.defaultInt("maxOutputTokens").ifPresent(value -> generationConfig.put("maxOutputTokens", value));

        Optional<Integer> thinkingBudget = config.defaultInt("thinkingBudget");
        Optional<Boolean> includeThoughts = config.defaultBoolean("includeThoughts");
        if (thinkingBudget.isPresent() || includeThoughts.isPresent()) {
            ObjectNode thinking = generationConfig.putObject("thinkingConfig");
            thinkingBudget.ifPresent(value -> thinking.put("thinkingBudget", value));
            includeThoughts.ifPresent(value -> thinking.put("includeThoughts", value));
        }
        return payload;
    }

    @Override
    protected void raiseVendorError(JsonNode root, String rawBody) {
        JsonNode error = root.get("error");
        if (error != null && error.isObject()) {
            String status = error.path("status").asText("");
            String message = error.path("message").asText(error.toString());
            throw new VendorApiException("Gemini API error" + (status.isEmpty() ? "" : " [" + status + "]") + ": " + message, rawBody);
        }
    }

    @Override
    protected Optional<String> extractContent(JsonNode root) {
        JsonNode candidate = root.path("candidates").path(0);
        if (!candidate.isObject()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            JsonNode value = part.get("text");
            if (value != null && value.isTextual() && !part.path("thought").asBoolean(false)) {
                text.append(value.asText());
            }
        }
        return Optional.of(text.toString());
    }

    @Override
    protected void checkCompletion(JsonNode root, String rawBody) {
        String finishReason = root.path("candidates").path(0).path("finishReason").asText("");
        if (finishReason.equals("MAX_TOKENS")) {
            throw new TruncatedResponseException(
                    "Gemini stopped at MAX_TOKENS before finishing; increase maxOutputTokens or split the input", rawBody);
        }
        if (!finishReason.isEmpty() && !finishReason.equals("STOP")) {
            throw new MalformedResponseException("Gemini finished with unexpected finishReason '" + finishReason + "'", rawBody);
        }
    }

    @Override
    protected Optional<JsonNode> extractUsage(JsonNode root) {
        return JsonBodies.object(root.get("usageMetadata"));
    }
}
