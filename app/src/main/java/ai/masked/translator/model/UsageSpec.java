package ai.masked.translator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dot paths into a vendor usage payload for one metric category.
 */
public record UsageSpec(Optional<String> totalPath, Map<String, String> breakdownPaths) {

    public UsageSpec {
        totalPath = totalPath == null ? Optional.empty() : totalPath;
        breakdownPaths = breakdownPaths == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(breakdownPaths));
    }
}
