package ai.masked.translator.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the model registry. {@code defaults} is the free-form vendor defaults
 * block (model name, temperature, token limits and similar); the record keeps its own copy
 * and hands out copies, so drivers cannot change registry state.
 */
public record ModelConfig(
        String key,
        String vendor,
        String endpoint,
        String format,
        JsonNode defaults,
        Optional<AuthRequirement> auth,
        Map<String, String> headers,
        ModelLimits limits,
        Map<String, UsageSpec> usage,
        Map<String, String> variables,
        boolean httpErrorHandling,
        Optional<String> notes
) {

    public ModelConfig {
        key = requireNonBlank(key, "key");
        vendor = requireNonBlank(vendor, "vendor");
        endpoint = requireNonBlank(endpoint, "endpoint");
        format = format == null || format.isBlank() ? "text" : format;
        defaults = defaults == null || !defaults.isObject() ? JsonNodeFactory.instance.objectNode() : defaults.deepCopy();
        auth = auth == null ? Optional.empty() : auth;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        limits = limits == null ? ModelLimits.NONE : limits;
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        notes = notes == null ? Optional.empty() : notes;
    }

    @Override
    public JsonNode defaults() {
        return defaults.deepCopy();
    }

    public Optional<String> defaultText(String name) {
        JsonNode value = defaults.get(name);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText()).filter(text -> !text.isBlank());
    }

    public double defaultDouble(String name, double fallback) {
        JsonNode value = defaults.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    public Optional<Integer> defaultInt(String name) {
        JsonNode value = defaults.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asInt());
        }
        try {
            return Optional.of(Integer.parseInt(value.asText().trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public Optional<Boolean> defaultBoolean(String name) {
        JsonNode value = defaults.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isBoolean() ? value.booleanValue() : Boolean.parseBoolean(value.asText().trim()));
    }

    private static String requireNonBlank(String value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        if (value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
