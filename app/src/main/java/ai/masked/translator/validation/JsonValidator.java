package ai.masked.translator.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Strict JSON syntax check. Trailing content after the root value is an error.
 */
public final class JsonValidator implements ContentValidator {

    private final ObjectMapper objectMapper;

    public JsonValidator() {
        this(new ObjectMapper());
    }

    public JsonValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public ValidationResult validate(String content) {
        if (content == null || content.isBlank()) {
            return ValidationResult.failure("JSON syntax error: empty input");
        }
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || node.isMissingNode()) {
                return ValidationResult.failure("JSON syntax error: empty input");
            }
            return ValidationResult.success();
        } catch (JsonProcessingException ex) {
            return ValidationResult.failure("JSON syntax error: " + ex.getOriginalMessage());
        }
    }

    /**
     * Parses content already known to be valid.
     */
    public JsonNode parse(String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("JSON syntax error: " + ex.getOriginalMessage(), ex);
        }
    }
}
