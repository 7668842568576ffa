package ai.masked.translator.config;

import ai.masked.translator.translate.TranslationFormat;
import ai.masked.translator.translate.TranslationRequest;
import ai.masked.translator.validation.RepairFeature;
import java.net.URI;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable runtime configuration assembled from CLI arguments, the environment and the model registry.
 */
public record Config(
        String modelKey,
        TranslationFormat format,
        Optional<Path> source,
        Optional<Path> output,
        List<String> filters,
        boolean dryRun,
        boolean verbose,
        Optional<String> context,
        String promptKey,
        Optional<String> sourceLang,
        Optional<String> targetLang,
        boolean validate,
        Map<String, String> variables,
        Optional<URI> proxy,
        Set<RepairFeature> repairs,
        LogFormat logFormat,
        Secrets secrets
) {

    public Config {
        modelKey = requireNonBlank(modelKey, "modelKey");
        Objects.requireNonNull(format, "format");
        source = source == null ? Optional.empty() : source;
        output = output == null ? Optional.empty() : output;
        filters = filters == null
                ? List.of()
                : filters.stream()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        context = context == null ? Optional.empty() : context.filter(value -> !value.isBlank());
        promptKey = requireNonBlank(promptKey, "promptKey");
        sourceLang = sourceLang == null ? Optional.empty() : sourceLang.filter(value -> !value.isBlank());
        targetLang = targetLang == null ? Optional.empty() : targetLang.filter(value -> !value.isBlank());
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        proxy = proxy == null ? Optional.empty() : proxy;
        repairs = repairs == null || repairs.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(repairs));
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    public TranslationRequest toRequest(String text) {
        return new TranslationRequest(text, modelKey, format, secrets.apiKey(), filters, dryRun, verbose, context,
                promptKey, sourceLang, targetLang, validate, variables, proxy, repairs);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
