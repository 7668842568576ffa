package ai.masked.translator.http;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Replaces known secret values with {@code ***} in diagnostic text.
 */
public final class SecretMasker {

    public static final String MASK = "***";

    private final List<String> secrets;

    public SecretMasker(Collection<String> secrets) {
        // longest first, so a secret containing another is masked whole
        this.secrets = Objects.requireNonNull(secrets, "secrets").stream()
                .filter(Objects::nonNull)
                .filter(secret -> !secret.isBlank())
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toUnmodifiableList());
    }

    public static SecretMasker none() {
        return new SecretMasker(List.of());
    }

    public String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String masked = text;
        for (String secret : secrets) {
            masked = masked.replace(secret, MASK);
        }
        return masked;
    }

    public List<String> secrets() {
        return secrets;
    }
}
