package ai.masked.translator.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Captures, compares and repairs the shape of JSON documents around a translation.
 */
public final class Schema {

    public static final String MISMATCH_MESSAGE = "Structure mismatch after translation";

    private Schema() {
    }

    public static SchemaNode capture(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return new SchemaNode.Leaf("null");
        }
        if (value.isObject()) {
            Map<String, SchemaNode> fields = new LinkedHashMap<>();
            value.fields().forEachRemaining(field -> fields.put(field.getKey(), capture(field.getValue())));
            return new SchemaNode.ObjectShape(fields);
        }
        if (value.isArray()) {
            List<SchemaNode> items = new ArrayList<>(value.size());
            value.forEach(item -> items.add(capture(item)));
            return new SchemaNode.ListShape(items);
        }
        if (value.isBoolean()) {
            return new SchemaNode.Leaf("boolean");
        }
        if (value.isIntegralNumber()) {
            return new SchemaNode.Leaf("integer");
        }
        if (value.isNumber()) {
            return new SchemaNode.Leaf("double");
        }
        return new SchemaNode.Leaf("string");
    }

    public static ValidationResult validate(SchemaNode before, SchemaNode after) {
        Optional<String> difference = firstDifference(before, after, "$");
        return difference
                .map(path -> ValidationResult.failure(MISMATCH_MESSAGE + " (first difference at " + path + ")"))
                .orElseGet(ValidationResult::success);
    }

    /**
     * Returns a repaired deep copy of {@code after}; {@code after} itself is not modified.
     * Without features the copy is returned unchanged.
     */
    public static JsonNode applyRepairs(JsonNode before, JsonNode after, Set<RepairFeature> features) {
        JsonNode repaired = after.deepCopy();
        if (features.contains(RepairFeature.REPAIR_MISSING_NULLS)) {
            restoreMissingNulls(before, repaired);
        }
        return repaired;
    }

    private static void restoreMissingNulls(JsonNode before, JsonNode after) {
        if (before.isObject() && after.isObject()) {
            ObjectNode target = (ObjectNode) after;
            for (Iterator<Map.Entry<String, JsonNode>> fields = before.fields(); fields.hasNext(); ) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode counterpart = target.get(field.getKey());
                if (counterpart == null) {
                    if (field.getValue().isNull()) {
                        target.putNull(field.getKey());
                    }
                } else {
                    restoreMissingNulls(field.getValue(), counterpart);
                }
            }
        } else if (before.isArray() && after.isArray()) {
            ArrayNode target = (ArrayNode) after;
            for (int i = 0; i < before.size(); i++) {
                if (i < target.size()) {
                    restoreMissingNulls(before.get(i), target.get(i));
                } else if (before.get(i).isNull() && i == target.size()) {
                    target.addNull();
                }
            }
        }
    }

    private static Optional<String> firstDifference(SchemaNode before, SchemaNode after, String path) {
        if (before instanceof SchemaNode.ObjectShape left && after instanceof SchemaNode.ObjectShape right) {
            if (!left.fields().keySet().equals(right.fields().keySet())) {
                return Optional.of(path);
            }
            for (Map.Entry<String, SchemaNode> field : left.fields().entrySet()) {
                Optional<String> nested = firstDifference(field.getValue(), right.fields().get(field.getKey()), path + "." + field.getKey());
                if (nested.isPresent()) {
                    return nested;
                }
            }
            return Optional.empty();
        }
        if (before instanceof SchemaNode.ListShape left && after instanceof SchemaNode.ListShape right) {
            if (left.items().size() != right.items().size()) {
                return Optional.of(path);
            }
            for (int i = 0; i < left.items().size(); i++) {
                Optional<String> nested = firstDifference(left.items().get(i), right.items().get(i), path + "[" + i + "]");
                if (nested.isPresent()) {
                    return nested;
                }
            }
            return Optional.empty();
        }
        return before.equals(after) ? Optional.empty() : Optional.of(path);
    }
}
