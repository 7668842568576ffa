package ai.masked.translator.translate;

import ai.masked.translator.http.SecretMasker;

import java.util.List;

/**
 * Container syntax, schema or length check failed; the translation is not applied.
 */
public class ValidationException extends TranslationException {

    private List<String> errors;

    public ValidationException(String message, List<String> errors) {
        super(errors.isEmpty() ? message : message + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }

    @Override
    public TranslationException redact(SecretMasker masker) {
        errors = errors.stream().map(masker::mask).toList();
        return super.redact(masker);
    }
}
