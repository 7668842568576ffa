package ai.masked.translator.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of a JSON value with the values removed. Equality is structural; object key order
 * does not matter, array order and length do.
 */
public interface SchemaNode {

    /** Scalar type tag: string, integer, double, boolean or null. */
    record Leaf(String type) implements SchemaNode {
        public Leaf {
            Objects.requireNonNull(type, "type");
        }
    }

    record ListShape(List<SchemaNode> items) implements SchemaNode {
        public ListShape {
            items = List.copyOf(items);
        }
    }

    record ObjectShape(Map<String, SchemaNode> fields) implements SchemaNode {
        public ObjectShape {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }
}
