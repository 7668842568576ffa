package ai.masked.translator.config;

import java.util.Optional;

/**
 * Credential for the selected model, read from the environment variable the registry names.
 */
public record Secrets(Optional<String> apiKey) {

    public Secrets {
        apiKey = apiKey == null ? Optional.empty() : apiKey.filter(value -> !value.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[apiKey=" + (apiKey.isPresent() ? "***" : "none") + "]";
    }
}
