package io.github.cyfko.truthtable.core.exception;

/**
 * Exception thrown when the lexer meets a character that cannot start any token.
 * <p>
 * Recognized characters are whitespace, letters (and digits inside a name),
 * parentheses and the operator spellings listed by {@code OperatorKind}. Anything else
 * is reported together with its position:
 * </p>
 * <pre>{@code
 * lexer.tokenize("A $ B");
 * // → "Unrecognized character '$' at position 2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends TruthTableException {

    private final int character;

    /**
     * @param character the offending code point
     * @param position  its 0-based position in the source text
     */
    public LexException(int character, int position) {
        super(String.format("Unrecognized character '%s' at position %d",
                new String(Character.toChars(character)), position), position);
        this.character = character;
    }

    /**
     * @return the offending code point
     */
    public int getCharacter() {
        return character;
    }
}
