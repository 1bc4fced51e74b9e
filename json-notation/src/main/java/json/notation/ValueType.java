package json.notation;

import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Map;

/// Coarse type of a tree value, as reported by [InspectResult#type()].
public enum ValueType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    NULL,
    OTHER,
    /// The path does not exist.
    UNDEFINED;

    /// Returns the type of a present value.
    public static ValueType of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Map) {
            return OBJECT;
        }
        if (value instanceof List) {
            return ARRAY;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return STRING;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Date || value instanceof TemporalAccessor) {
            return DATE;
        }
        return OTHER;
    }
}
