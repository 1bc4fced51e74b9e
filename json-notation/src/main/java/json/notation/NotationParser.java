package json.notation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Parser for notation and glob strings into [Note] lists.
/// Implements a single-pass scanner over the grammar:
///
/// ```
/// path    := note ("." ident | bracket)*
/// note    := ident | bracket
/// ident   := [A-Za-z_$][A-Za-z0-9_$]*
/// bracket := "[" (digits | quoted) "]"
/// quoted  := '"' ... '"' | "'" ... "'"
/// ```
///
/// In glob mode an `ident` or the contents of a `bracket` may also be the wildcard `*`,
/// and the whole string may be prefixed with a single `!`.
final class NotationParser {

    private static final Logger LOG = Logger.getLogger(NotationParser.class.getName());

    /// Result of parsing a glob: the negation flag and the notes after the `!`.
    record Parsed(boolean negated, List<Note> notes) {
        Parsed {
            notes = List.copyOf(notes);
        }
    }

    private final String notation;
    private final boolean glob;
    private int pos;

    private NotationParser(String notation, boolean glob) {
        this.notation = notation;
        this.glob = glob;
        this.pos = 0;
    }

    /// Parses a concrete (wildcard-free) notation.
    /// @throws NotationException of kind INVALID_SYNTAX if the notation is invalid
    static List<Note> parse(String notation) {
        if (notation == null) {
            throw NotationException.invalidSyntax(null);
        }
        LOG.finer(() -> "Parsing notation: " + notation);
        return new NotationParser(notation, false).parseNotes().notes();
    }

    /// Parses a glob, which may carry wildcards and a leading negation.
    /// @throws NotationException of kind INVALID_SYNTAX if the glob is invalid
    static Parsed parseGlob(String glob) {
        if (glob == null) {
            throw new NotationException(NotationException.Kind.INVALID_SYNTAX, "Invalid glob notation: 'null'");
        }
        LOG.finer(() -> "Parsing glob: " + glob);
        return new NotationParser(glob, true).parseNotes();
    }

    static boolean isIdentifier(String s) {
        Objects.requireNonNull(s, "s must not be null");
        if (s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            if (!isIdentifierPart(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private Parsed parseNotes() {
        boolean negated = false;
        if (glob && pos < notation.length() && notation.charAt(pos) == '!') {
            negated = true;
            pos++;
        }
        if (pos >= notation.length()) {
            throw new NotationException("Empty notation", notation, pos);
        }

        final var notes = new ArrayList<Note>();
        notes.add(parseFirst());
        while (pos < notation.length()) {
            final char c = notation.charAt(pos);
            final Note note = switch (c) {
                case '.' -> parseDotNote();
                case '[' -> parseBracket();
                default -> throw new NotationException("Unexpected character", notation, pos);
            };
            notes.add(note);
        }
        return new Parsed(negated, notes);
    }

    private Note parseFirst() {
        final char c = notation.charAt(pos);
        if (c == '[') {
            return parseBracket();
        }
        if (glob && c == '*') {
            pos++;
            return new Note.Wildcard(false);
        }
        return parseIdentifier();
    }

    private Note parseDotNote() {
        pos++; // skip .

        if (pos >= notation.length()) {
            throw new NotationException("Unexpected end of notation after '.'", notation, pos);
        }
        if (glob && notation.charAt(pos) == '*') {
            pos++;
            return new Note.Wildcard(false);
        }
        return parseIdentifier();
    }

    private Note parseIdentifier() {
        final int start = pos;
        if (!isIdentifierStart(notation.charAt(pos))) {
            throw new NotationException("Expected identifier", notation, pos);
        }
        pos++;
        while (pos < notation.length() && isIdentifierPart(notation.charAt(pos))) {
            pos++;
        }
        return new Note.Identifier(notation.substring(start, pos));
    }

    private Note parseBracket() {
        pos++; // skip [

        if (pos >= notation.length()) {
            throw new NotationException("Unexpected end of notation after '['", notation, pos);
        }

        final char c = notation.charAt(pos);

        if (glob && c == '*') {
            pos++;
            expectChar(']');
            return new Note.Wildcard(true);
        }

        if (c == '\'' || c == '"') {
            return parseQuotedKey(c);
        }

        if (isDigit(c)) {
            return parseIndex();
        }

        throw new NotationException("Unexpected character in bracket notation", notation, pos);
    }

    private Note parseQuotedKey(char quote) {
        final int start = pos + 1;
        final int end = notation.indexOf(quote + "]", start);
        if (end < 0) {
            throw new NotationException("Unterminated quoted key", notation, pos);
        }
        pos = end + 2; // skip closing quote and ]
        return new Note.QuotedKey(notation.substring(start, end), quote);
    }

    private Note parseIndex() {
        final int start = pos;
        while (pos < notation.length() && isDigit(notation.charAt(pos))) {
            pos++;
        }
        final var digits = notation.substring(start, pos);
        expectChar(']');
        try {
            return new Note.Index(Integer.parseInt(digits), digits);
        } catch (NumberFormatException e) {
            throw new NotationException("Index out of range", notation, start);
        }
    }

    private void expectChar(char expected) {
        if (pos >= notation.length()) {
            throw new NotationException("Expected '" + expected + "' but reached end of notation", notation, pos);
        }
        if (notation.charAt(pos) != expected) {
            throw new NotationException("Expected '" + expected + "'", notation, pos);
        }
        pos++;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
