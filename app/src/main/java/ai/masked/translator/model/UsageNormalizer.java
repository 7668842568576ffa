package ai.masked.translator.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a vendor usage payload onto the categories declared under {@code usage} in the
 * model configuration. Paths are dot separated; anything absent or non-numeric counts as zero.
 */
public final class UsageNormalizer {

    public UsageReport normalize(ModelConfig config, Optional<JsonNode> rawUsage) {
        if (rawUsage.isEmpty() || !rawUsage.get().isObject() || config.usage().isEmpty()) {
            return UsageReport.EMPTY;
        }
        JsonNode usage = rawUsage.get();
        Map<String, UsageMetric> categories = new LinkedHashMap<>();
        config.usage().forEach((category, spec) -> {
            int total = spec.totalPath().map(path -> intAt(usage, path)).orElse(0);
            Map<String, Integer> breakdown = new LinkedHashMap<>();
            spec.breakdownPaths().forEach((label, path) -> breakdown.put(label, intAt(usage, path)));
            categories.put(category, new UsageMetric(total, breakdown));
        });
        return new UsageReport(categories);
    }

    /**
     * Reads an integer at a dot path such as {@code completion_tokens_details.reasoning_tokens}.
     * Array segments may be addressed by index.
     */
    static int intAt(JsonNode root, String path) {
        if (path == null || path.isBlank()) {
            return 0;
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null) {
                return 0;
            }
            if (current.isArray() && segment.chars().allMatch(Character::isDigit) && !segment.isEmpty()) {
                current = current.get(Integer.parseInt(segment));
            } else {
                current = current.get(segment);
            }
        }
        if (current == null || current.isNull()) {
            return 0;
        }
        if (current.isNumber()) {
            return current.asInt();
        }
        if (current.isTextual()) {
            try {
                return (int) Double.parseDouble(current.asText().trim());
            } catch (NumberFormatException ex) {
                return 0;
            }
        }
        return 0;
    }
}
