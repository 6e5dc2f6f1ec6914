package io.github.cyfko.truthtable.core.evaluation;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.exception.EvaluationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates an {@link Expression} tree under one {@link Assignment}.
 * <p>
 * Semantics per node:
 * </p>
 * <ul>
 *   <li>{@code Variable}: value looked up in the assignment</li>
 *   <li>{@code NOT}: negation of the operand</li>
 *   <li>{@code AND}, {@code OR}, {@code XOR}, {@code IMPLIES}, {@code IFF}: standard two-valued
 *       semantics, see {@link io.github.cyfko.truthtable.core.api.OperatorKind#apply(boolean, boolean)}</li>
 * </ul>
 * <p>
 * Both operands of a binary node are always evaluated, so an incomplete assignment is
 * reported even when the other side alone would decide the result. Nodes are visited in
 * post-order with an explicit operand stack, so the depth of the tree is not bounded by
 * the thread stack.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Evaluator {

    private Evaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * @param expression the tree to evaluate
     * @param assignment values for the variables of the tree
     * @return the value of the expression
     * @throws EvaluationException if a variable of the tree has no value in the assignment
     */
    public static boolean evaluate(Expression expression, Assignment assignment) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");
        return evaluatePostOrder(Expression.postOrder(expression), assignment);
    }

    /**
     * Evaluates nodes listed by {@link Expression#postOrder(Expression)} with an operand stack.
     *
     * @param nodes      the tree in post-order
     * @param assignment values for the variables of the tree
     * @return the value of the last node
     */
    static boolean evaluatePostOrder(List<Expression> nodes, Assignment assignment) {
        Deque<Boolean> operands = new ArrayDeque<>();
        for (Expression node : nodes) {
            if (node instanceof Expression.Variable variable) {
                if (!assignment.isAssigned(variable.name())) {
                    throw EvaluationException.missingVariable(variable.name());
                }
                operands.push(assignment.valueOf(variable.name()));
            } else if (node instanceof Expression.Unary) {
                operands.push(!operands.pop());
            } else {
                Expression.Binary binary = (Expression.Binary) node;
                boolean right = operands.pop();
                boolean left = operands.pop();
                operands.push(binary.kind().apply(left, right));
            }
        }
        return operands.pop();
    }
}
