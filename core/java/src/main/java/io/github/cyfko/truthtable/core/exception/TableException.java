package io.github.cyfko.truthtable.core.exception;

/**
 * Exception thrown when a truth table would exceed the configured resource limits.
 * <p>
 * A table over {@code n} variables holds {@code 2^n} rows; the builder refuses to start
 * when {@code n} is above the policy's {@code maxVariables} instead of allocating an
 * unbounded amount of memory.
 * </p>
 * <pre>{@code
 * builder.build(parsed, text); // 21 variables, default policy
 * // → "Too many variables (21, max: 20). Policy applied: DEFAULT_POLICY"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TableException extends TruthTableException {

    public enum Reason {
        TOO_MANY_VARIABLES
    }

    private final Reason reason;
    private final int variableCount;
    private final int maxVariables;

    private TableException(Reason reason, int variableCount, int maxVariables, String message) {
        super(message, NO_POSITION);
        this.reason = reason;
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    public static TableException tooManyVariables(int variableCount, int maxVariables, String policyName) {
        return new TableException(Reason.TOO_MANY_VARIABLES, variableCount, maxVariables, String.format(
                "Too many variables (%d, max: %d). Policy applied: %s", variableCount, maxVariables, policyName));
    }

    public Reason getReason() {
        return reason;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getMaxVariables() {
        return maxVariables;
    }
}
