package ai.masked.translator.translate;

import java.util.Locale;

/**
 * Container format of the document being translated.
 */
public enum TranslationFormat {
    TEXT,
    HTML,
    JSON;

    public static TranslationFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Format must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "text", "txt", "plain" -> TEXT;
            case "html" -> HTML;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported format: " + raw + " (expected text, html or json)");
        };
    }

    /**
     * Lowercase identifier used in prompt catalogs and driver payloads.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
