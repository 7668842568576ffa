package ai.masked.translator.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Translated text extracted from a vendor response, plus the vendor's raw usage payload if it sent one.
 */
public record DriverResponse(String text, Optional<JsonNode> usage) {

    public DriverResponse {
        Objects.requireNonNull(text, "text");
        usage = usage == null ? Optional.empty() : usage.filter(node -> !node.isNull() && !node.isMissingNode());
    }
}
