package ai.masked.translator.model;

import ai.masked.translator.translate.ConfigurationException;
import java.util.Locale;

/**
 * Where a vendor expects the API credential.
 */
public enum AuthType {
    HEADER,
    FORM,
    QUERY;

    public static AuthType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return HEADER;
        }
        try {
            return AuthType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported auth type: " + raw, ex);
        }
    }
}
