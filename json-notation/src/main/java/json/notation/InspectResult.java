package json.notation;

/// Outcome of [Notation#inspectGet(String)] or [Notation#inspectRemove(String)].
///
/// `has` is true whenever the path exists, even if its value is `null`; this is what
/// distinguishes an absent member from a present but empty one.
///
/// @param notation the inspected notation
/// @param has whether the tree has the notated member
/// @param value the member value, or null when absent
/// @param type the coarse value type, [ValueType#UNDEFINED] when absent
/// @param level one-based depth of the resolved note, or of the first missing note
/// @param lastNote source text of that note, e.g. `[1]`
/// @param lastNoteNormalized `Integer` index or `String` key of that note
/// @param parentIsArray whether the container holding (or lacking) that note is a list
public record InspectResult(
        String notation,
        boolean has,
        Object value,
        ValueType type,
        int level,
        String lastNote,
        Object lastNoteNormalized,
        boolean parentIsArray) {

    static InspectResult present(String notation, Object value, int level, Note note, boolean parentIsArray) {
        return new InspectResult(notation, true, value, ValueType.of(value), level,
                note.text(), note.normalized(), parentIsArray);
    }

    static InspectResult absent(String notation, int level, Note note, boolean parentIsArray) {
        return new InspectResult(notation, false, null, ValueType.UNDEFINED, level,
                note.text(), note.normalized(), parentIsArray);
    }
}
