package json.notation;

/// Write mode for [Notation#set(String, Object, SetMode)].
public enum SetMode {
    /// Replace any existing value.
    OVERWRITE,
    /// Splice the value into a list at the index, shifting later items. Fails on a map.
    INSERT,
    /// Leave an existing value untouched.
    NO_OVERWRITE
}
