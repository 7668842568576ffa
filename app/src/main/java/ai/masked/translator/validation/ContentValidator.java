package ai.masked.translator.validation;

/**
 * Checks a document before it is sent or after it comes back.
 */
@FunctionalInterface
public interface ContentValidator {

    ValidationResult validate(String content);
}
