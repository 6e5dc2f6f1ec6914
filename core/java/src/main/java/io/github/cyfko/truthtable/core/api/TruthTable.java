package io.github.cyfko.truthtable.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complete truth table of an expression.
 * <p>
 * Holds one {@link TableRow} per assignment, in increasing index order, along with the
 * verbatim expression text used as the header of the result column. Instances are
 * immutable.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTable {

    private final String expressionText;
    private final ParsedExpression parsed;
    private final List<TableRow> rows;

    /**
     * @param expressionText the expression text as the user wrote it
     * @param parsed         the parsed tree and its variables
     * @param rows           all {@code 2^n} rows in index order
     * @throws IllegalArgumentException if the row count does not match the variable count
     */
    public TruthTable(String expressionText, ParsedExpression parsed, List<TableRow> rows) {
        this.expressionText = Objects.requireNonNull(expressionText, "expressionText cannot be null");
        this.parsed = Objects.requireNonNull(parsed, "parsed cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");

        long expected = 1L << parsed.variables().size();
        if (rows.size() != expected) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d rows for %d variable(s), got %d", expected, parsed.variables().size(), rows.size()));
        }
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String expressionText() {
        return expressionText;
    }

    public Expression expression() {
        return parsed.expression();
    }

    public VariableSet variables() {
        return parsed.variables();
    }

    public List<TableRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return indexes of the rows evaluating to {@code 1}
     */
    public List<Long> minterms() {
        return indexesWhere(true);
    }

    /**
     * @return indexes of the rows evaluating to {@code 0}
     */
    public List<Long> maxterms() {
        return indexesWhere(false);
    }

    private List<Long> indexesWhere(boolean result) {
        List<Long> indexes = new ArrayList<>();
        for (TableRow row : rows) {
            if (row.result() == result) {
                indexes.add(row.index());
            }
        }
        return Collections.unmodifiableList(indexes);
    }

    @Override
    public String toString() {
        return "TruthTable[" + expressionText + ", variables=" + variables() + ", rows=" + rows.size() + "]";
    }
}
