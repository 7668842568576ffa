package ai.masked.translator.validation;

import java.util.List;

/**
 * Outcome of a validator: valid, or the ordered list of problems found.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("a valid result carries no errors");
        }
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one error");
        }
        return new ValidationResult(false, errors);
    }

    public static ValidationResult failure(String error) {
        return failure(List.of(error));
    }
}
