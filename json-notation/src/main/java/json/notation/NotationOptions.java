package json.notation;

import java.util.Map;
import java.util.Objects;

/// Options for a [Notation] accessor.
///
/// @param strict when true, operations on absent paths fail instead of returning a soft
///               "absent" result ([Notation#get(String)], [Notation#remove(String)] and strict filtering)
/// @param preserveIndices when true, removing a list item leaves a `null` hole instead of
///                        shifting later items down
public record NotationOptions(boolean strict, boolean preserveIndices) {

    public static final String STRICT = "strict";
    public static final String PRESERVE_INDICES = "preserveIndices";

    /// `strict = false`, `preserveIndices = false`
    public static final NotationOptions DEFAULTS = new NotationOptions(false, false);

    public NotationOptions withStrict(boolean strict) {
        return new NotationOptions(strict, preserveIndices);
    }

    public NotationOptions withPreserveIndices(boolean preserveIndices) {
        return new NotationOptions(strict, preserveIndices);
    }

    /// Shallow-merges the named options over these ones. Options not named keep their value.
    /// @param overrides option name to value; recognised names are [#STRICT] and [#PRESERVE_INDICES]
    /// @return the merged options
    /// @throws IllegalArgumentException on an unknown option name
    public NotationOptions merge(Map<String, Boolean> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        var merged = this;
        for (final var entry : overrides.entrySet()) {
            final boolean value = Boolean.TRUE.equals(entry.getValue());
            merged = switch (entry.getKey()) {
                case STRICT -> merged.withStrict(value);
                case PRESERVE_INDICES -> merged.withPreserveIndices(value);
                default -> throw new IllegalArgumentException("Unknown notation option: " + entry.getKey());
            };
        }
        return merged;
    }
}
