package io.github.cyfko.truthtable.core.api;

import java.util.Objects;

/**
 * One line of a truth table: an assignment and the expression's value under it.
 *
 * @param index      the row index, equal to the assignment's packed bits
 * @param assignment the variable values of this row
 * @param result     the value of the expression under {@code assignment}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TableRow(long index, Assignment assignment, boolean result) {

    public TableRow {
        Objects.requireNonNull(assignment, "assignment cannot be null");
    }

    /**
     * @param column position of the variable in the table's variable set
     * @return the variable value as {@code 0} or {@code 1}
     */
    public int bit(int column) {
        return assignment.valueAt(column) ? 1 : 0;
    }

    /**
     * @return the result as {@code 0} or {@code 1}
     */
    public int resultBit() {
        return result ? 1 : 0;
    }
}
