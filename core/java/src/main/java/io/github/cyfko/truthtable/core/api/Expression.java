package io.github.cyfko.truthtable.core.api;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Immutable boolean expression tree.
 * <p>
 * The hierarchy is closed: a node is either a {@link Variable}, a {@link Unary} operation
 * or a {@link Binary} operation. Every node exclusively owns its children, so the
 * structure is a strict tree with no sharing and no cycles. Trees are built once by the
 * parser and are safe to read from any number of threads.
 * </p>
 *
 * <pre>{@code
 * // A && (B || !C)
 * Expression e = Expression.and(
 *         Expression.variable("A"),
 *         Expression.or(Expression.variable("B"), Expression.not(Expression.variable("C"))));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expression permits Expression.Variable, Expression.Unary, Expression.Binary {

    /**
     * Reference to a named variable.
     *
     * @param name the case-sensitive variable name
     */
    record Variable(String name) implements Expression {
        public Variable {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Variable name is required");
            }
        }
    }

    /**
     * Prefix operation on a single operand.
     *
     * @param kind    a unary operator
     * @param operand the operand subtree
     */
    record Unary(OperatorKind kind, Expression operand) implements Expression {
        public Unary {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(operand, "operand cannot be null");
            if (!kind.isUnary()) {
                throw new IllegalArgumentException(kind + " is not a unary operator");
            }
        }
    }

    /**
     * Infix operation on two operands.
     *
     * @param kind  a binary operator
     * @param left  the left operand subtree
     * @param right the right operand subtree
     */
    record Binary(OperatorKind kind, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(right, "right cannot be null");
            if (kind.isUnary()) {
                throw new IllegalArgumentException(kind + " is not a binary operator");
            }
        }
    }

    static Expression variable(String name) {
        return new Variable(name);
    }

    static Expression not(Expression operand) {
        return new Unary(OperatorKind.NOT, operand);
    }

    static Expression and(Expression left, Expression right) {
        return new Binary(OperatorKind.AND, left, right);
    }

    static Expression or(Expression left, Expression right) {
        return new Binary(OperatorKind.OR, left, right);
    }

    static Expression binary(OperatorKind kind, Expression left, Expression right) {
        return new Binary(kind, left, right);
    }

    /**
     * Lists the nodes of a tree children first, left operand before right operand.
     * <p>
     * The walk uses an explicit stack, so chains of any length are supported.
     * </p>
     *
     * <pre>{@code
     * // (A && B) || !C
     * Expression.postOrder(e); // [A, B, A && B, C, !C, (A && B) || !C]
     * }</pre>
     *
     * @param root the tree
     * @return every node of the tree, each one after its operands
     */
    static List<Expression> postOrder(Expression root) {
        Objects.requireNonNull(root, "root cannot be null");
        Deque<Expression> pending = new ArrayDeque<>();
        Deque<Expression> reversed = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            reversed.push(node);
            if (node instanceof Unary unary) {
                pending.push(unary.operand());
            } else if (node instanceof Binary binary) {
                pending.push(binary.left());
                pending.push(binary.right());
            }
        }
        return new ArrayList<>(reversed);
    }
}
