package ai.masked.translator.validation;

import java.util.Locale;

/**
 * Opt-in repairs applied to a translated JSON tree before its structure is compared.
 */
public enum RepairFeature {
    /** Put back keys and array slots that were {@code null} in the source and went missing. */
    REPAIR_MISSING_NULLS;

    public static RepairFeature from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Repair feature must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("MISSING_NULLS")) {
            return REPAIR_MISSING_NULLS;
        }
        return RepairFeature.valueOf(normalized);
    }
}
