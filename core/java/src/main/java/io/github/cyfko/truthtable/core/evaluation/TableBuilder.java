package io.github.cyfko.truthtable.core.evaluation;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.api.TableRow;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.api.VariableSet;
import io.github.cyfko.truthtable.core.config.TruthTablePolicy;
import io.github.cyfko.truthtable.core.exception.TableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates every assignment of an expression's variables and evaluates each one.
 * <p>
 * For {@code n} variables the builder walks indexes {@code 0 .. 2^n - 1} in increasing
 * order, derives each {@link Assignment} from the index bits (first variable = most
 * significant bit) and appends one {@link TableRow}. No row is skipped or reordered.
 * </p>
 * <p>
 * The variable count is checked against {@link TruthTablePolicy#maxVariables()} before
 * anything is allocated.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TableBuilder {

    private final TruthTablePolicy policy;

    public TableBuilder() {
        this(TruthTablePolicy.defaults());
    }

    public TableBuilder(TruthTablePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Truth table policy is required");
        }
        this.policy = policy;
    }

    /**
     * Builds the complete table.
     *
     * @param parsed         the expression tree and its variables
     * @param expressionText the verbatim expression text, kept as the result column header
     * @return the table with {@code 2^n} rows
     * @throws TableException if the expression has more variables than the policy allows
     */
    public TruthTable build(ParsedExpression parsed, String expressionText) {
        Objects.requireNonNull(parsed, "parsed cannot be null");
        Objects.requireNonNull(expressionText, "expressionText cannot be null");

        VariableSet variables = parsed.variables();
        checkVariableCount(variables.size());

        List<Expression> nodes = Expression.postOrder(parsed.expression());
        long rowCount = 1L << variables.size();
        List<TableRow> rows = new ArrayList<>((int) Math.min(rowCount, 1 << 20));
        for (long index = 0; index < rowCount; index++) {
            Assignment assignment = Assignment.fromIndex(variables, index);
            boolean result = Evaluator.evaluatePostOrder(nodes, assignment);
            rows.add(new TableRow(index, assignment, result));
        }
        return new TruthTable(expressionText, parsed, rows);
    }

    /**
     * @param variableCount number of distinct variables
     * @throws TableException if the count is above the policy cap
     */
    public void checkVariableCount(int variableCount) {
        if (variableCount > policy.maxVariables()) {
            throw TableException.tooManyVariables(variableCount, policy.maxVariables(), policy.policyName());
        }
    }

    public TruthTablePolicy getPolicy() {
        return policy;
    }
}
