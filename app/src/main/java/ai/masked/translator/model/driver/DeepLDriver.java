package ai.masked.translator.model.driver;

import ai.masked.translator.model.BodyType;
import ai.masked.translator.model.DriverOptions;
import ai.masked.translator.model.DriverRequest;
import ai.masked.translator.model.DriverResponse;
import ai.masked.translator.model.ModelConfig;
import ai.masked.translator.model.ModelDriver;
import ai.masked.translator.translate.MalformedResponseException;
import ai.masked.translator.translate.TranslationFormat;
import ai.masked.translator.translate.VendorApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DeepL {@code /v2/translate}. Sends form fields instead of a prompt. For JSON documents the
 * structural characters are swapped for private empty tags, which DeepL's HTML tag handling
 * keeps in place, and swapped back on the way out.
 */
public final class DeepLDriver implements ModelDriver {

    public static final String VENDOR = "deepl";

    static final String DEFAULT_TARGET_LANG = "EN";
    static final String DEFAULT_FORMALITY = "prefer_more";

    private static final Map<Character, String> JSON_PROTECTION = new LinkedHashMap<>();

    static {
        JSON_PROTECTION.put('{', "<jlc/>");
        JSON_PROTECTION.put('}', "<jrc/>");
        JSON_PROTECTION.put('[', "<jlb/>");
        JSON_PROTECTION.put(']', "<jrb/>");
        JSON_PROTECTION.put(':', "<jcol/>");
        JSON_PROTECTION.put(',', "<jcomma/>");
        JSON_PROTECTION.put('"', "<jqt/>");
    }

    private final ObjectMapper objectMapper;

    public DeepLDriver(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public DriverRequest buildRequest(ModelConfig config, String preparedText, DriverOptions options) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("text", options.format() == TranslationFormat.JSON ? protectJson(preparedText) : preparedText);
        form.put("target_lang", options.targetLang().or(() -> config.defaultText("target_lang")).orElse(DEFAULT_TARGET_LANG));
        form.put("formality", config.defaultText("formality").orElse(DEFAULT_FORMALITY));
        options.sourceLang()
                .filter(value -> !value.equalsIgnoreCase("auto"))
                .or(() -> config.defaultText("source_lang"))
                .ifPresent(value -> form.put("source_lang", value));
        options.context().or(() -> config.defaultText("context"))
                .ifPresent(value -> form.put("context", value));
        if (options.format() != TranslationFormat.TEXT) {
            form.put("tag_handling", "html");
            form.put("preserve_formatting", "1");
            form.put("outline_detection", "1");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", BodyType.FORM.contentType());
        headers.putAll(config.headers());
        return new DriverRequest(config.endpoint(), headers, encodeForm(form), BodyType.FORM);
    }

    @Override
    public DriverResponse parseResponse(ModelConfig config, String rawBody) {
        JsonNode root = JsonBodies.read(objectMapper, rawBody);
        JsonNode translations = root.get("translations");
        if ((translations == null || !translations.isArray()) && root.path("message").isTextual()) {
            throw new VendorApiException("DeepL API error: " + root.path("message").asText(), rawBody);
        }
        Optional<String> text = JsonBodies.text(root.path("translations").path(0).get("text"));
        if (text.isEmpty()) {
            throw new MalformedResponseException("DeepL translation failed", rawBody);
        }
        return new DriverResponse(unprotectJson(text.get()), Optional.empty());
    }

    static String protectJson(String text) {
        StringBuilder protectedText = new StringBuilder(text.length() + 32);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            String replacement = JSON_PROTECTION.get(ch);
            if (replacement != null) {
                protectedText.append(replacement);
            } else {
                protectedText.append(ch);
            }
        }
        return protectedText.toString();
    }

    static String unprotectJson(String text) {
        String restored = text;
        for (Map.Entry<Character, String> entry : JSON_PROTECTION.entrySet()) {
            restored = restored.replace(entry.getValue(), String.valueOf(entry.getKey()));
        }
        return restored;
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
