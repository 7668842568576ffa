package ai.masked.translator.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Credential placement declared by a model: header, form field or query parameter.
 */
public record AuthRequirement(
        AuthType type,
        String keyName,
        Optional<String> prefix,
        Optional<String> env,
        Optional<String> helpUrl
) {

    public AuthRequirement {
        Objects.requireNonNull(type, "type");
        if (keyName == null || keyName.isBlank()) {
            throw new IllegalArgumentException("keyName must not be blank");
        }
        prefix = prefix == null ? Optional.empty() : prefix.filter(value -> !value.isBlank());
        env = env == null ? Optional.empty() : env.filter(value -> !value.isBlank());
        helpUrl = helpUrl == null ? Optional.empty() : helpUrl.filter(value -> !value.isBlank());
    }

    /**
     * Value to send, with the prefix (for example {@code Bearer}) prepended when one is declared.
     */
    public String credentialValue(String secret) {
        return prefix.map(value -> value + " " + secret).orElse(secret);
    }
}
