package io.github.cyfko.truthtable.core.api;

import java.util.Objects;

/**
 * Result of parsing: the expression tree and its variables in first-occurrence order.
 *
 * @param expression the root of the parsed tree
 * @param variables  the distinct variables referenced by the tree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParsedExpression(Expression expression, VariableSet variables) {

    public ParsedExpression {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(variables, "variables cannot be null");
    }
}
