package io.github.cyfko.truthtable.core.exception;

import java.util.Objects;

/**
 * Exception thrown when a token sequence does not form a valid expression.
 * <p>
 * Each instance carries a {@link Kind} and the character position of the offending
 * token so callers can point at the exact column.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");        // EMPTY_EXPRESSION  → "Empty expression at position 0"
 * parser.parse("A &&");    // MISSING_OPERAND   → "Missing operand at position 4: expected a variable, '(' or NOT but found end of input"
 * parser.parse("((A)");    // UNMATCHED_PAREN   → "Unmatched parenthesis at position 0: '(' is never closed"
 * parser.parse("A B");     // UNEXPECTED_TOKEN  → "Unexpected token at position 2: expected an operator or end of input but found 'B'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ParseException extends TruthTableException {

    /**
     * Category of a parse failure.
     */
    public enum Kind {
        UNEXPECTED_TOKEN("Unexpected token"),
        UNMATCHED_PAREN("Unmatched parenthesis"),
        EMPTY_EXPRESSION("Empty expression"),
        MISSING_OPERAND("Missing operand"),
        NESTING_TOO_DEEP("Nesting too deep");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Kind kind;

    /**
     * @param kind     the failure category
     * @param position 0-based character position of the offending token
     * @param detail   what was expected and what was found, may be {@code null}
     */
    public ParseException(Kind kind, int position, String detail) {
        super(buildMessage(kind, position, detail), position);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    private static String buildMessage(Kind kind, int position, String detail) {
        Objects.requireNonNull(kind, "kind cannot be null");
        String base = kind.getLabel() + " at position " + position;
        return detail == null || detail.isBlank() ? base : base + ": " + detail;
    }
}
