package ai.masked.translator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized usage, keyed by category in the order the model configuration declares them.
 */
public record UsageReport(Map<String, UsageMetric> categories) {

    public static final UsageReport EMPTY = new UsageReport(Map.of());

    public UsageReport {
        categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }
}
