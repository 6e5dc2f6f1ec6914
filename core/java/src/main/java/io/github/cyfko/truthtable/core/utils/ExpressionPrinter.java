package io.github.cyfko.truthtable.core.utils;

import io.github.cyfko.truthtable.core.api.Expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Renders expression trees back to text, using each operator's canonical symbol.
 *
 * <pre>{@code
 * Expression e = parser.parse("!A | B & C").expression();
 * ExpressionPrinter.toPostfix(e); // ["A", "!", "B", "C", "&&", "||"]
 * ExpressionPrinter.toInfix(e);   // "(!A || (B && C))"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionPrinter {

    private ExpressionPrinter() {
        // Utility class - prevent instantiation
    }

    /**
     * @param expression the tree
     * @return the tree in reverse Polish notation
     */
    public static List<String> toPostfix(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        List<String> output = new ArrayList<>();
        for (Expression node : Expression.postOrder(expression)) {
            if (node instanceof Expression.Variable variable) {
                output.add(variable.name());
            } else if (node instanceof Expression.Unary unary) {
                output.add(unary.kind().getSymbol());
            } else {
                output.add(((Expression.Binary) node).kind().getSymbol());
            }
        }
        return output;
    }

    /**
     * @param expression the tree
     * @return the tree in infix notation, every binary operation parenthesized
     */
    public static String toInfix(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Deque<String> operands = new ArrayDeque<>();
        for (Expression node : Expression.postOrder(expression)) {
            if (node instanceof Expression.Variable variable) {
                operands.push(variable.name());
            } else if (node instanceof Expression.Unary unary) {
                operands.push(unary.kind().getSymbol() + operands.pop());
            } else {
                String right = operands.pop();
                String left = operands.pop();
                operands.push("(" + left + " " + ((Expression.Binary) node).kind().getSymbol() + " " + right + ")");
            }
        }
        return operands.pop();
    }
}
