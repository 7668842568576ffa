package ai.masked.translator.config;

import java.util.Optional;

/**
 * Lookup of environment values; tests substitute a map-backed reader.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Value of {@code key} if it is set and not blank, trimmed.
     */
    default Optional<String> nonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
