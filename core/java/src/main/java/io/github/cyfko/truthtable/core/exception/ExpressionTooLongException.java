package io.github.cyfko.truthtable.core.exception;

/**
 * Exception thrown before lexing when the expression text is longer than the policy allows.
 * <p>
 * The position of the error is the maximum length, that is the index of the first character
 * beyond the limit. {@link #describe(String)} therefore places its caret under that character:
 * </p>
 * <pre>
 * [ERROR]: A &amp;&amp; B &amp;&amp; C
 *                    ^
 * [ERROR]: Expression too long (11 characters, max: 10). Policy applied: CUSTOM_POLICY
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionTooLongException extends TruthTableException {

    private final int length;
    private final int maxLength;

    public ExpressionTooLongException(int length, int maxLength, String policyName) {
        super(String.format("Expression too long (%d characters, max: %d). Policy applied: %s",
                length, maxLength, policyName), maxLength);
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
