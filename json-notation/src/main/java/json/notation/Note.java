package json.notation;

import java.util.Objects;

/// A single addressing unit of a notation path.
///
/// Notes are resolved to a variant once, at parse time:
/// - Identifier: a plain key written with dot syntax (e.g., `name`)
/// - QuotedKey: a key written with bracket syntax (e.g., `['first name']`)
/// - Index: a list index (e.g., `[0]`)
/// - Wildcard: glob only, `*` matches one key and `[*]` matches one index
///
/// Two notes are equal iff their normalized forms match: `name` equals `["name"]`,
/// and `[1]` equals `[01]`. Each note keeps its source text so that joining the
/// notes of a parsed path reproduces the input exactly.
public sealed interface Note permits Note.Identifier, Note.QuotedKey, Note.Index, Note.Wildcard {

    /// The source text of this note, e.g. `name`, `['a b']`, `[0]` or `[*]`.
    String text();

    /// The normalized form: a `String` key, an `Integer` index, or the wildcard text.
    Object normalized();

    /// Whether this note addresses list items: an index or the `[*]` wildcard.
    boolean isIndexLike();

    default boolean isWildcard() {
        return this instanceof Wildcard;
    }

    /// Whether this note is a map key (plain or quoted).
    default boolean isKey() {
        return this instanceof Identifier || this instanceof QuotedKey;
    }

    /// Whether this note is written in bracket syntax.
    default boolean isBracketed() {
        return text().charAt(0) == '[';
    }

    /// Whether this note matches everything `other` matches, at the same position.
    default boolean covers(Note other) {
        Objects.requireNonNull(other, "other must not be null");
        if (equals(other)) {
            return true;
        }
        if (this instanceof Wildcard w) {
            return w.indexed() == other.isIndexLike();
        }
        return false;
    }

    /// Returns the note matching both this and `other`, or null when they are disjoint.
    /// Of two equal notes the one with the lexicographically smaller text is returned.
    default Note intersect(Note other) {
        Objects.requireNonNull(other, "other must not be null");
        if (equals(other)) {
            return text().compareTo(other.text()) <= 0 ? this : other;
        }
        if (covers(other)) {
            return other;
        }
        if (other.covers(this)) {
            return this;
        }
        return null;
    }

    /// Returns the canonical note for a map key: plain when it is a valid identifier, quoted otherwise.
    static Note key(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (NotationParser.isIdentifier(key)) {
            return new Identifier(key);
        }
        // a quoted key ends at the first quote followed by ']', so pick the quote that keeps it intact
        final char quote = key.contains("\"]") ? '\'' : '"';
        return new QuotedKey(key, quote);
    }

    /// Returns the canonical note for a list index.
    static Note index(int index) {
        return new Index(index, Integer.toString(index));
    }

    /// A plain key: `name`
    record Identifier(String name) implements Note {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public Object normalized() {
            return name;
        }

        @Override
        public boolean isIndexLike() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Note n && n.isKey() && name.equals(n.normalized());
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return text();
        }
    }

    /// A bracketed, quoted key: `['a b']` or `["a b"]`
    record QuotedKey(String key, char quote) implements Note {
        public QuotedKey {
            Objects.requireNonNull(key, "key must not be null");
            if (quote != '"' && quote != '\'') {
                throw new IllegalArgumentException("quote must be ' or \"");
            }
        }

        @Override
        public String text() {
            return "[" + quote + key + quote + "]";
        }

        @Override
        public Object normalized() {
            return key;
        }

        @Override
        public boolean isIndexLike() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Note n && n.isKey() && key.equals(n.normalized());
        }

        @Override
        public int hashCode() {
            return key.hashCode();
        }

        @Override
        public String toString() {
            return text();
        }
    }

    /// A list index: `[0]`. The digits are kept as written.
    record Index(int index, String digits) implements Note {
        public Index {
            Objects.requireNonNull(digits, "digits must not be null");
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative");
            }
        }

        @Override
        public String text() {
            return "[" + digits + "]";
        }

        @Override
        public Object normalized() {
            return index;
        }

        @Override
        public boolean isIndexLike() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Index other && other.index == index;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(index);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    /// A glob wildcard: `*` (one key) or `[*]` (one index)
    record Wildcard(boolean indexed) implements Note {

        @Override
        public String text() {
            return indexed ? "[*]" : "*";
        }

        @Override
        public Object normalized() {
            return text();
        }

        @Override
        public boolean isIndexLike() {
            return indexed;
        }

        @Override
        public String toString() {
            return text();
        }
    }
}
