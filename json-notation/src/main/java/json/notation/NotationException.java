package json.notation;

/// Exception thrown by every notation, glob and tree operation.
/// Each failure carries a [Kind] so callers can branch without parsing messages.
/// This is a runtime exception as notation failures are typically programming errors
/// or, in strict mode, deliberate assertions about the shape of the data.
public class NotationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// The distinguished failure kinds.
    public enum Kind {
        /// The tree handed to the accessor is not a map or a list.
        INVALID_SOURCE,
        /// The copy/move destination or target is not a map or a list.
        INVALID_DESTINATION,
        /// A notation or glob string violates the grammar.
        INVALID_SYNTAX,
        /// Strict mode: an implied list index does not exist.
        MISSING_INDEX,
        /// Strict mode: an implied map property does not exist.
        MISSING_PROPERTY,
        /// Insert mode used against a map.
        INSERT_ON_NON_LIST,
        /// A key note met a list, an index note met a map, or a walk hit a scalar.
        TYPE_MISMATCH,
        /// Strict filtering could not empty a container of the expected kind.
        INTEGRITY_ERROR,
        /// merge/separate received the wrong input shape.
        INVALID_NOTATIONS_OBJECT
    }

    private final Kind kind;
    private final int position;
    private final String notation;

    /// Creates a new exception of the given kind.
    public NotationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
        this.position = -1;
        this.notation = null;
    }

    /// Creates a new syntax exception with position information.
    public NotationException(String message, String notation, int position) {
        super(formatMessage(message, notation, position));
        this.kind = Kind.INVALID_SYNTAX;
        this.position = position;
        this.notation = notation;
    }

    /// Returns the failure kind.
    public Kind kind() {
        return kind;
    }

    /// Returns the position in the notation where parsing failed, or -1 if unknown.
    public int position() {
        return position;
    }

    /// Returns the notation that was being parsed, or null if unknown.
    public String notation() {
        return notation;
    }

    static NotationException invalidSyntax(String notation) {
        return new NotationException(Kind.INVALID_SYNTAX, "Invalid notation: '" + notation + "'");
    }

    private static String formatMessage(String message, String notation, int position) {
        if (notation == null || position < 0) {
            return message;
        }
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        sb.append(" in notation: ").append(notation);
        if (position < notation.length()) {
            sb.append(" (near '").append(notation.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
