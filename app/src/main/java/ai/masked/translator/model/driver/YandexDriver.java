package ai.masked.translator.model.driver;

import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.MissingConfigException;
import ai.masked.translator.translate.TruncatedResponseException;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Optional;

/**
 * Yandex Foundation Models completion API. Needs the cloud folder id as the per-call
 * variable {@code folder_id}.
 */
public final class YandexDriver extends MarkerChatDriver {

    public static final String VENDOR = "yandex";
    public static final String FOLDER_ID = "folder_id";

    static final int DEFAULT_MAX_TOKENS = 2000;
    private static final String TRUNCATED_STATUS = "ALTERNATIVE_STATUS_TRUNCATED_FINAL";

    public YandexDriver(PromptCatalog prompts, ObjectMapper objectMapper) {
        super(prompts, objectMapper, "Yandex");
    }

    @Override
    protected ObjectNode buildPayload(ModelConfig config, String systemPrompt, String userContent, DriverOptions options) {
        String folderId = options.variable(FOLDER_ID)
                .orElseThrow(() -> new MissingConfigException("Missing Yandex folder_id"));
        String model = requireModelName(config);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("modelUri", "gpt://" + folderId + "/" + model);
        ObjectNode completionOptions = payload.putObject("completionOptions");
        completionOptions.put("stream", false);
        completionOptions.put("temperature", config.defaultDouble("temperature", 0.0));
        completionOptions.put("maxTokens", config.defaultInt("max_tokens").orElse(DEFAULT_MAX_TOKENS));
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("text", systemPrompt);
        messages.addObject().put("role", "user").put("text", userContent);
        return payload;
    }

    @Override
    protected void raiseVendorError(JsonNode root, String rawBody) {
        JsonNode error = root.get("error");
        if (error == null || error.isNull()) {
            return;
        }
        String message = error.path("message").isTextual() ? error.path("message").asText() : error.toString();
        int code = error.path("httpCode").asInt(0);
        String httpStatus = error.path("httpStatus").asText("");

        if (code == 400 && message.toLowerCase(Locale.ROOT).contains("folder id")) {
            throw new VendorApiException("Yandex API folder-id mismatch: " + message, rawBody);
        }
        if (code == 401 || httpStatus.toLowerCase(Locale.ROOT).contains("unauthorized")) {
            throw new VendorApiException("Yandex API authentication error: " + message, rawBody);
        }
        if (code == 500) {
            throw new VendorApiException("Yandex API internal server error: " + message, rawBody);
        }
        throw new VendorApiException("Yandex API error" + (code > 0 ? " (HTTP " + code + ")" : "") + ": " + message, rawBody);
    }

    @Override
    protected Optional<String> extractContent(JsonNode root) {
        Optional<String> alternative = JsonBodies.text(firstAlternative(root).path("message").get("text"));
        return alternative.or(() -> JsonBodies.text(root.path("completions").path(0).get("text")));
    }

    @Override
    protected void checkCompletion(JsonNode root, String rawBody) {
        if (TRUNCATED_STATUS.equals(firstAlternative(root).path("status").asText(""))) {
            throw new TruncatedResponseException(
                    "Yandex: translation was truncated; increase max_tokens or split the input", rawBody);
        }
    }

    @Override
    protected Optional<JsonNode> extractUsage(JsonNode root) {
        return JsonBodies.object(root.path("result").get("usage"));
    }

    private static JsonNode firstAlternative(JsonNode root) {
        return root.path("result").path("alternatives").path(0);
    }
}
