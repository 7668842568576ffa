package ai.masked.translator.model.driver;

import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.MissingConfigException;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * xAI Grok chat completions. The error field is either a plain string or an object with code and message.
 */
public final class XaiDriver extends ChatCompletionsDriver {

    public static final String VENDOR = "xai";

    public XaiDriver(PromptCatalog prompts, ObjectMapper objectMapper) {
        super(prompts, objectMapper, "Grok");
    }

    @Override
    protected String requireModelName(ModelConfig config) {
        return config.defaultText("model")
                .orElseThrow(() -> new MissingConfigException("Missing xAI model name"));
    }

    @Override
    protected void customizePayload(ObjectNode payload, ModelConfig config) {
        payload.put("stream", false);
        config.defaultInt("max_tokens").ifPresent(value -> payload.put("max_tokens", value));
    }

    @Override
    protected void raiseVendorError(JsonNode root, String rawBody) {
        JsonNode error = root.get("error");
        if (error == null || error.isNull()) {
            return;
        }
        String code;
        String message;
        if (error.isObject()) {
            code = error.path("code").asText("unknown");
            message = error.path("message").asText(error.toString());
        } else {
            code = root.path("code").asText("unknown");
            message = error.asText();
        }
        throw new VendorApiException("Grok API error [" + code + "]: " + message, rawBody);
    }
}
