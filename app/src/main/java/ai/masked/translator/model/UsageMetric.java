package ai.masked.translator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Total and labelled breakdown for one usage category, such as tokens or characters.
 */
public record UsageMetric(int total, Map<String, Integer> breakdown) {

    public UsageMetric {
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
