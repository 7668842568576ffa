package ai.masked.translator.model.driver;

import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * OpenAI chat completions.
 */
public final class OpenAiDriver extends ChatCompletionsDriver {

    public static final String VENDOR = "openai";

    public OpenAiDriver(PromptCatalog prompts, ObjectMapper objectMapper) {
        super(prompts, objectMapper, "OpenAI");
    }

    @Override
    protected void raiseVendorError(JsonNode root, String rawBody) {
        JsonNode error = root.get("error");
        if (error != null && error.isObject()) {
            String message = error.path("message").asText(error.toString());
            throw new VendorApiException("OpenAI API error: " + message, rawBody);
        }
    }
}
