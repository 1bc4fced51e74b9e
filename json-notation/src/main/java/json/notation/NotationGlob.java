package json.notation;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A parsed glob pattern: a notation that may contain wildcards and a single leading `!`.
///
/// `*` matches any one key and `[*]` matches any one list index. A pattern matches the node
/// it addresses and everything nested beneath it, so `car` selects `car.model` too.
/// A leading `!` negates the whole pattern.
///
/// Usage examples:
/// ```java
/// NotationGlob glob = NotationGlob.create("car.*");
/// glob.glob();                    // "car" (redundant trailing wildcards are dropped)
/// glob.test("car.model");         // true
/// NotationGlob.create("!car[*]").emptyValue(); // ARRAY
/// NotationGlob.create("*").covers("a.b");      // true
/// ```
public final class NotationGlob {

    private static final Logger LOG = Logger.getLogger(NotationGlob.class.getName());

    private final String glob;
    private final String absGlob;
    private final boolean negated;
    private final List<Note> notes;
    private final List<Note> reducedNotes;
    private final ValueType emptyValue;

    private NotationGlob(boolean negated, List<Note> parsedNotes, String trimmed) {
        this.negated = negated;
        if (negated) {
            this.notes = parsedNotes;
            this.absGlob = trimmed.substring(1);
            this.glob = trimmed;
            final var last = parsedNotes.get(parsedNotes.size() - 1);
            if (parsedNotes.size() > 1 && last.isWildcard()) {
                this.reducedNotes = parsedNotes.subList(0, parsedNotes.size() - 1);
                this.emptyValue = last.isIndexLike() ? ValueType.ARRAY : ValueType.OBJECT;
            } else {
                this.reducedNotes = parsedNotes;
                this.emptyValue = null;
            }
        } else {
            int size = parsedNotes.size();
            while (size > 1 && parsedNotes.get(size - 1).isWildcard()) {
                size--;
            }
            this.notes = parsedNotes.subList(0, size);
            this.reducedNotes = this.notes;
            this.emptyValue = null;
            this.absGlob = size == parsedNotes.size() ? trimmed : NotationPath.toNotation(this.notes);
            this.glob = this.absGlob;
        }
    }

    /// Parses and normalizes a glob.
    /// @throws NotationException of kind INVALID_SYNTAX if the glob is null or invalid
    public static NotationGlob create(String glob) {
        if (glob == null) {
            throw new NotationException(NotationException.Kind.INVALID_SYNTAX, "Invalid glob notation: 'null'");
        }
        final var trimmed = glob.trim();
        final var parsed = NotationParser.parseGlob(trimmed);
        final var created = new NotationGlob(parsed.negated(), parsed.notes(), trimmed);
        LOG.finer(() -> "Created glob '" + created.glob + "' from '" + glob + "'");
        return created;
    }

    /// Checks whether the given string is a valid glob. Never throws.
    public static boolean isValid(String glob) {
        if (glob == null) {
            return false;
        }
        try {
            NotationParser.parseGlob(glob.trim());
            return true;
        } catch (NotationException e) {
            return false;
        }
    }

    /// Convenience for `create(a).covers(create(b))`.
    public static boolean covers(String globA, String globB) {
        return create(globA).covers(create(globB));
    }

    /// The normalized glob, including any leading `!`.
    public String glob() {
        return glob;
    }

    /// The normalized glob without its negation prefix.
    public String absGlob() {
        return absGlob;
    }

    public boolean isNegated() {
        return negated;
    }

    /// The notes of the normalized glob.
    public List<Note> notes() {
        return notes;
    }

    /// The notes that must exist for this glob to apply: for a negated glob ending in a
    /// wildcard this omits that wildcard, otherwise it equals [#notes()].
    public List<Note> reducedNotes() {
        return reducedNotes;
    }

    /// For a negated glob ending in a wildcard, the kind of container left behind once
    /// everything beneath is removed: OBJECT for `.*`, ARRAY for `[*]`. Null otherwise.
    public ValueType emptyValue() {
        return emptyValue;
    }

    public Note first() {
        return notes.get(0);
    }

    public Note last() {
        return notes.get(notes.size() - 1);
    }

    /// The parent glob text (without negation), or null for a single-note glob.
    public String parent() {
        return notes.size() > 1 ? NotationPath.toNotation(notes.subList(0, notes.size() - 1)) : null;
    }

    /// Whether this is `*` or `[*]`, optionally negated.
    public boolean isBareWildcard() {
        return notes.size() == 1 && notes.get(0).isWildcard();
    }

    /// Whether this is `!*` or `![*]`.
    public boolean isNegateAll() {
        return negated && isBareWildcard();
    }

    /// Whether any note of this glob is a wildcard.
    public boolean hasWildcards() {
        return wildcardCount(notes) > 0;
    }

    /// Whether this glob matches everything `other` matches. The polarity of `other` is ignored.
    public boolean covers(NotationGlob other) {
        Objects.requireNonNull(other, "other must not be null");
        return covers(notes, negated, other.notes);
    }

    /// Parses `other` as a glob and checks [#covers(NotationGlob)].
    public boolean covers(String other) {
        return covers(create(other));
    }

    /// Tests this glob against a concrete notation.
    /// @throws NotationException of kind INVALID_SYNTAX if the notation is invalid or contains
    ///         wildcards or negation
    public boolean test(String notation) {
        final var path = NotationPath.parse(notation);
        return covers(notes, negated, path.notes());
    }

    static boolean covers(List<Note> a, boolean aNegated, List<Note> b) {
        if (aNegated && a.size() > b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            final var noteA = a.get(i);
            if (i >= b.size()) {
                if (!noteA.isWildcard()) {
                    return false;
                }
            } else if (!noteA.covers(b.get(i))) {
                return false;
            }
        }
        return true;
    }

    static int wildcardCount(List<Note> notes) {
        int count = 0;
        for (final var note : notes) {
            if (note.isWildcard()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NotationGlob other && negated == other.negated && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(negated, notes);
    }

    @Override
    public String toString() {
        return glob;
    }
}
