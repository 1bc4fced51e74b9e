package json.notation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// An immutable, validated notation path: a non-empty sequence of concrete [Note]s, root to leaf.
///
/// Usage examples:
/// ```java
/// NotationPath path = NotationPath.parse("car.colors[0]");
/// path.size();                          // 3
/// path.last().normalized();             // 0
/// NotationPath.parent("car.colors[0]"); // "car.colors"
/// NotationPath.split("a['b c'][1]");    // ["a", "['b c']", "[1]"]
/// ```
///
/// Note that `*` and `!` are not valid here; see [NotationGlob] for glob notation.
public final class NotationPath {

    private static final Logger LOG = Logger.getLogger(NotationPath.class.getName());

    private final List<Note> notes;
    private final String notation;

    private NotationPath(List<Note> notes) {
        this.notes = List.copyOf(notes);
        this.notation = toNotation(this.notes);
    }

    /// Parses and validates a notation string.
    /// @param notation the notation to parse
    /// @return the parsed path
    /// @throws NotationException of kind INVALID_SYNTAX if the notation is null, empty or invalid
    public static NotationPath parse(String notation) {
        LOG.finer(() -> "Parsing path: " + notation);
        return new NotationPath(NotationParser.parse(notation));
    }

    /// Creates a path from already resolved notes.
    /// @throws IllegalArgumentException if notes is empty or contains a wildcard
    public static NotationPath of(List<Note> notes) {
        Objects.requireNonNull(notes, "notes must not be null");
        if (notes.isEmpty()) {
            throw new IllegalArgumentException("notes must not be empty");
        }
        for (final var note : notes) {
            if (note.isWildcard()) {
                throw new IllegalArgumentException("a notation path cannot contain wildcards: " + notes);
            }
        }
        return new NotationPath(notes);
    }

    /// Checks whether the given string is a valid (wildcard-free) notation. Never throws.
    public static boolean isValid(String notation) {
        if (notation == null) {
            return false;
        }
        try {
            NotationParser.parse(notation);
            return true;
        } catch (NotationException e) {
            return false;
        }
    }

    /// Splits a notation into the source text of its notes.
    /// @throws NotationException if the notation is invalid
    public static List<String> split(String notation) {
        return parse(notation).notes.stream().map(Note::text).toList();
    }

    /// Joins note texts into a notation string. Bracketed notes attach directly, others
    /// are separated by a dot. Null or empty entries are skipped.
    public static String join(List<String> notes) {
        Objects.requireNonNull(notes, "notes must not be null");
        final var sb = new StringBuilder();
        for (final var note : notes) {
            if (note == null || note.isEmpty()) {
                continue;
            }
            if (sb.length() > 0 && note.charAt(0) != '[') {
                sb.append('.');
            }
            sb.append(note);
        }
        return sb.toString();
    }

    /// Returns the number of notes in the notation.
    public static int countNotes(String notation) {
        return parse(notation).size();
    }

    /// Returns the text of the first (root) note, e.g. `first` for `first.prop2.last`.
    public static String first(String notation) {
        return parse(notation).first().text();
    }

    /// Returns the text of the last note, e.g. `last` for `first.prop2.last`.
    public static String last(String notation) {
        return parse(notation).last().text();
    }

    /// Returns the parent notation (everything before the last note), or null for a single note.
    public static String parent(String notation) {
        final var parent = parse(notation).parent();
        return parent == null ? null : parent.toString();
    }

    /// Iterates successively longer prefixes of the notation, left to right.
    /// For `a.b.c` the visitor sees `a`, `a.b` and `a.b.c`. Iteration stops as soon as the
    /// visitor returns `false`.
    /// @throws NotationException if the notation is invalid
    public static void eachNote(String notation, NoteVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        parse(notation).eachNote(visitor);
    }

    /// Instance form of [#eachNote(String, NoteVisitor)].
    public void eachNote(NoteVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        final var level = new StringBuilder();
        for (int i = 0; i < notes.size(); i++) {
            final var note = notes.get(i);
            if (i > 0 && !note.isBracketed()) {
                level.append('.');
            }
            level.append(note.text());
            if (!visitor.visit(level.toString(), note, i, notes)) {
                return;
            }
        }
    }

    public List<Note> notes() {
        return notes;
    }

    public int size() {
        return notes.size();
    }

    public Note first() {
        return notes.get(0);
    }

    public Note last() {
        return notes.get(notes.size() - 1);
    }

    /// Returns the parent path, or null when this path has a single note.
    public NotationPath parent() {
        return notes.size() > 1 ? new NotationPath(notes.subList(0, notes.size() - 1)) : null;
    }

    /// Returns the path made of the first `length` notes.
    public NotationPath prefix(int length) {
        if (length < 1 || length > notes.size()) {
            throw new IndexOutOfBoundsException("prefix length " + length + " out of range 1.." + notes.size());
        }
        return length == notes.size() ? this : new NotationPath(notes.subList(0, length));
    }

    /// Returns a new path with `note` appended.
    public NotationPath child(Note note) {
        Objects.requireNonNull(note, "note must not be null");
        final var list = new ArrayList<Note>(notes.size() + 1);
        list.addAll(notes);
        list.add(note);
        return of(list);
    }

    static String toNotation(List<Note> notes) {
        return join(notes.stream().map(Note::text).toList());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NotationPath other && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return notes.hashCode();
    }

    /// Returns the notation string; for a parsed path this is exactly the input.
    @Override
    public String toString() {
        return notation;
    }
}
