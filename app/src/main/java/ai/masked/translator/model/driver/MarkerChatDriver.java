package ai.masked.translator.model.driver;

import ai.masked.translator.model.BodyType;
import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.DriverRequest;
import ai.masked.translator.model.DriverResponse;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.model.ModelDriver;
import ai.masked.translator.prompt.PromptCatalog;
import ai.masked.translator.translate.MalformedResponseException;
import ai.masked.translator.translate.MissingConfigException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base for chat vendors using the marker protocol. Subclasses shape the payload and
 * know where the vendor puts its content, errors and stop reason.
 */
abstract class MarkerChatDriver implements ModelDriver {

    static final String DEFAULT_SOURCE_LANG = "auto";
    static final String DEFAULT_TARGET_LANG = "EN";

    protected final PromptCatalog prompts;
    protected final ObjectMapper objectMapper;
    private final String vendorLabel;

    MarkerChatDriver(PromptCatalog prompts, ObjectMapper objectMapper, String vendorLabel) {
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.vendorLabel = Objects.requireNonNull(vendorLabel, "vendorLabel");
    }

    @Override
    public DriverRequest buildRequest(ModelConfig config, String preparedText, DriverOptions options) {
        String systemPrompt = prompts.render(options.promptKey(), options.format().id(), promptVariables(config, options));
        ObjectNode payload = buildPayload(config, systemPrompt, MarkerProtocol.wrap(preparedText), options);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", BodyType.JSON.contentType());
        headers.putAll(config.headers());
        return new DriverRequest(config.endpoint(), headers, JsonBodies.write(objectMapper, payload), BodyType.JSON);
    }

    @Override
    public DriverResponse parseResponse(ModelConfig config, String rawBody) {
        JsonNode root = JsonBodies.read(objectMapper, rawBody);
        raiseVendorError(root, rawBody);
        String content = extractContent(root)
                .orElseThrow(() -> new MalformedResponseException(vendorLabel + " translation failed: response has no content", rawBody));
        checkCompletion(root, rawBody);
        if (content.isBlank()) {
            throw new MalformedResponseException(vendorLabel + " translation failed: empty content", rawBody);
        }
        String text = MarkerProtocol.extract(content, vendorLabel, rawBody);
        return new DriverResponse(text, extractUsage(root));
    }

    protected abstract ObjectNode buildPayload(ModelConfig config, String systemPrompt, String userContent, DriverOptions options);

    /**
     * Throws {@link ai.masked.translator.translate.VendorApiException} when the body is an error envelope.
     */
    protected abstract void raiseVendorError(JsonNode root, String rawBody);

    protected abstract Optional<String> extractContent(JsonNode root);

    /**
     * Throws when the vendor reports that generation stopped early.
     */
    protected abstract void checkCompletion(JsonNode root, String rawBody);

    protected abstract Optional<JsonNode> extractUsage(JsonNode root);

    protected String requireModelName(ModelConfig config) {
        return config.defaultText("model")
                .orElseThrow(() -> new MissingConfigException("Missing " + vendorLabel + " model name"));
    }

    protected String vendorLabel() {
        return vendorLabel;
    }

    private Map<String, String> promptVariables(ModelConfig config, DriverOptions options) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("source", options.sourceLang().or(() -> config.defaultText("source_lang")).orElse(DEFAULT_SOURCE_LANG));
        variables.put("target", options.targetLang().or(() -> config.defaultText("target_lang")).orElse(DEFAULT_TARGET_LANG));
        variables.put("start", MarkerProtocol.START);
        variables.put("end", MarkerProtocol.END);
        variables.put("context", options.context().map(value -> "Context: " + value).orElse(""));
        return variables;
    }
}
