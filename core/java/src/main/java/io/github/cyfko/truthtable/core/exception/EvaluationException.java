package io.github.cyfko.truthtable.core.exception;

/**
 * Exception thrown when an expression is evaluated under an assignment that does not
 * supply a value for one of its variables.
 * <p>
 * The table builder always hands the evaluator a complete assignment, so this only
 * surfaces when the evaluator is called directly with a hand-made assignment.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends TruthTableException {

    public enum Reason {
        MISSING_VARIABLE
    }

    private final Reason reason;
    private final String variableName;

    private EvaluationException(Reason reason, String variableName, String message) {
        super(message, NO_POSITION);
        this.reason = reason;
        this.variableName = variableName;
    }

    /**
     * @param variableName the variable the assignment has no value for
     * @return a new exception with reason {@link Reason#MISSING_VARIABLE}
     */
    public static EvaluationException missingVariable(String variableName) {
        return new EvaluationException(Reason.MISSING_VARIABLE, variableName,
                String.format("Assignment has no value for variable '%s'", variableName));
    }

    public Reason getReason() {
        return reason;
    }

    public String getVariableName() {
        return variableName;
    }
}
