package io.github.cyfko.truthtable.core.exception;

/**
 * Base class of every error raised while turning an expression into a truth table.
 * <p>
 * All failures are detected synchronously by the pass that owns them (lexing, parsing,
 * evaluation, table building) and propagated immediately. No partial table is ever
 * produced: a caller either gets a complete table or one of these exceptions.
 * </p>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     System.out.print(generator.render(text));
 * } catch (TruthTableException e) {
 *     System.err.println(e.describe(text));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LexException
 * @see ParseException
 * @see EvaluationException
 * @see TableException
 */
public abstract class TruthTableException extends RuntimeException {

    /**
     * Marker for errors that are not attached to a character of the source text.
     */
    public static final int NO_POSITION = -1;

    private static final String ERROR_TAG = "[ERROR]: ";

    private final int position;

    protected TruthTableException(String message, int position) {
        super(message);
        this.position = position;
    }

    protected TruthTableException(String message, int position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * Returns the 0-based character position of the offending input, or {@link #NO_POSITION}.
     *
     * @return the position in the source text
     */
    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }

    /**
     * Renders a diagnostic for this error against the text it was raised for.
     * <p>
     * Positioned errors print the source line followed by a caret under the offending
     * column, then the message:
     * </p>
     * <pre>
     * [ERROR]: A &amp;&amp;
     *                ^
     * [ERROR]: Missing operand at position 4: ...
     * </pre>
     *
     * @param source the expression text the error was raised for
     * @return a multi-line, human-readable description
     */
    public String describe(String source) {
        if (source == null || !hasPosition() || position > source.length()) {
            return ERROR_TAG + getMessage();
        }
        return ERROR_TAG + source + System.lineSeparator()
                + " ".repeat(ERROR_TAG.length() + source.codePointCount(0, position)) + "^" + System.lineSeparator()
                + ERROR_TAG + getMessage();
    }
}
