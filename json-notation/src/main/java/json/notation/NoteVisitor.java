package json.notation;

import java.util.List;

/// Callback for [NotationPath#eachNote(String, NoteVisitor)].
@FunctionalInterface
public interface NoteVisitor {

    /// Visits one level of a notation.
    /// @param levelNotation the notation up to and including this note, e.g. `a.b` for the second note of `a.b.c`
    /// @param note the note at this level
    /// @param index zero-based level index
    /// @param notes all notes of the notation
    /// @return `false` to stop iterating, `true` to continue
    boolean visit(String levelNotation, Note note, int index, List<Note> notes);
}
