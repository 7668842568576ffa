package ai.masked.translator.model;

import ai.masked.translator.translate.TranslationFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call options a driver needs to build its request.
 */
public record DriverOptions(
        TranslationFormat format,
        String promptKey,
        Optional<String> context,
        Optional<String> sourceLang,
        Optional<String> targetLang,
        Map<String, String> variables
) {

    public static final String DEFAULT_PROMPT_KEY = "translator";

    public DriverOptions {
        Objects.requireNonNull(format, "format");
        promptKey = promptKey == null || promptKey.isBlank() ? DEFAULT_PROMPT_KEY : promptKey;
        context = context == null ? Optional.empty() : context.map(String::trim).filter(value -> !value.isEmpty());
        sourceLang = sourceLang == null ? Optional.empty() : sourceLang.filter(value -> !value.isBlank());
        targetLang = targetLang == null ? Optional.empty() : targetLang.filter(value -> !value.isBlank());
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static DriverOptions of(TranslationFormat format) {
        return new DriverOptions(format, DEFAULT_PROMPT_KEY, Optional.empty(), Optional.empty(), Optional.empty(), Map.of());
    }

    public Optional<String> variable(String name) {
        return Optional.ofNullable(variables.get(name)).filter(value -> !value.isBlank());
    }
}
