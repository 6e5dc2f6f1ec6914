package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Expression;
import io.github.cyfko.truthtable.core.api.OperatorKind;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.api.VariableSet;
import io.github.cyfko.truthtable.core.exception.ParseException;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Recursive-descent parser building an {@link Expression} tree from a token stream.
 * <p>
 * One grammar level per binary precedence, driven by {@link OperatorKind#getPrecedence()}:
 * </p>
 * <pre>
 * expr         := iff_expr
 * iff_expr     := implies_expr (IFF implies_expr)*
 * implies_expr := xor_expr (IMPLIES xor_expr)*
 * xor_expr     := or_expr (XOR or_expr)*
 * or_expr      := and_expr (OR and_expr)*
 * and_expr     := unary (AND unary)*
 * unary        := NOT unary | primary
 * primary      := VARIABLE | '(' expr ')'
 * </pre>
 * <p>
 * Binary operators are left-associative and build left-leaning trees; NOT is a
 * right-associative prefix. Variables are collected in first-occurrence order.
 * Parentheses and NOT chains count towards the nesting depth, which is bounded
 * so that recursion stays within the thread stack.
 * </p>
 *
 * <p><strong>Performance characteristics:</strong></p>
 * <ul>
 *   <li>Time: O(n) where n = number of tokens, no backtracking</li>
 *   <li>Space: O(d) stack frames where d = nesting depth</li>
 * </ul>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrecedenceParser {

    private static final int LOWEST_PRECEDENCE = 1;
    private static final int HIGHEST_BINARY_PRECEDENCE = OperatorKind.AND.getPrecedence();

    private final Supplier<Token> tokens;
    private final int maxNestingDepth;
    private final VariableSet.Builder variables = VariableSet.builder();

    private Token current;
    private int depth;
    private int operatorCount;
    private boolean consumed;

    /**
     * @param tokens          token supplier; must keep returning {@link TokenType#END_OF_INPUT} once exhausted
     * @param maxNestingDepth maximum depth of parentheses and NOT chains
     */
    public PrecedenceParser(Supplier<Token> tokens, int maxNestingDepth) {
        this.tokens = Objects.requireNonNull(tokens, "tokens cannot be null");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses straight from a lexer, pulling tokens lazily.
     */
    public static ParsedExpression parse(Lexer lexer, int maxNestingDepth) {
        return new PrecedenceParser(lexer::nextToken, maxNestingDepth).parse();
    }

    /**
     * Parses an already tokenized expression.
     *
     * @param tokens a token list ending with {@link TokenType#END_OF_INPUT}
     */
    public static ParsedExpression parse(List<Token> tokens, int maxNestingDepth) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.END_OF_INPUT)) {
            throw new IllegalArgumentException("Token list must end with END_OF_INPUT");
        }
        Iterator<Token> iterator = tokens.iterator();
        Token sentinel = tokens.get(tokens.size() - 1);
        return new PrecedenceParser(() -> iterator.hasNext() ? iterator.next() : sentinel, maxNestingDepth).parse();
    }

    /**
     * Runs the parse.
     *
     * @return the tree and its variables
     * @throws ParseException if the token stream is not a valid expression
     * @throws IllegalStateException if called twice
     */
    public ParsedExpression parse() {
        if (consumed) {
            throw new IllegalStateException("PrecedenceParser instances are single-use");
        }
        consumed = true;

        advance();
        if (current.is(TokenType.END_OF_INPUT)) {
            throw new ParseException(ParseException.Kind.EMPTY_EXPRESSION, 0, "nothing to evaluate");
        }

        Expression expression = parseBinary(LOWEST_PRECEDENCE);

        if (current.is(TokenType.RIGHT_PAREN)) {
            throw new ParseException(ParseException.Kind.UNMATCHED_PAREN, current.position(),
                    "')' has no matching '('");
        }
        if (!current.is(TokenType.END_OF_INPUT)) {
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, current.position(),
                    "expected an operator or end of input but found " + current.describe());
        }

        return new ParsedExpression(expression, variables.build());
    }

    private Expression parseBinary(int precedence) {
        if (precedence > HIGHEST_BINARY_PRECEDENCE) {
            return parseUnary();
        }

        Expression left = parseBinary(precedence + 1);
        while (isBinaryOperatorAt(precedence)) {
            OperatorKind kind = current.operator();
            advance();
            Expression right = parseBinary(precedence + 1);
            left = new Expression.Binary(kind, left, right);
        }
        return left;
    }

    private boolean isBinaryOperatorAt(int precedence) {
        return current.is(TokenType.OPERATOR)
                && !current.operator().isUnary()
                && current.operator().getPrecedence() == precedence;
    }

    private Expression parseUnary() {
        if (current.isOperator(OperatorKind.NOT)) {
            Token not = current;
            advance();
            enter(not);
            Expression operand = parseUnary();
            leave();
            return new Expression.Unary(OperatorKind.NOT, operand);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        switch (current.type()) {
            case VARIABLE -> {
                String name = current.text();
                variables.add(name);
                advance();
                return new Expression.Variable(name);
            }
            case LEFT_PAREN -> {
                Token open = current;
                advance();
                enter(open);
                Expression inner = parseBinary(LOWEST_PRECEDENCE);
                leave();

                if (current.is(TokenType.END_OF_INPUT)) {
                    throw new ParseException(ParseException.Kind.UNMATCHED_PAREN, open.position(),
                            "'(' is never closed");
                }
                if (!current.is(TokenType.RIGHT_PAREN)) {
                    throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, current.position(),
                            "expected ')' or an operator but found " + current.describe());
                }
                advance();
                return inner;
            }
            default -> throw missingOperand();
        }
    }

    private ParseException missingOperand() {
        if (!current.is(TokenType.OPERATOR) && variables.size() == 0 && operatorCount == 0 && restIsEmpty()) {
            return new ParseException(ParseException.Kind.EMPTY_EXPRESSION, 0,
                    "parentheses enclose no variable or operator");
        }
        return new ParseException(ParseException.Kind.MISSING_OPERAND, current.position(),
                "expected a variable, '(' or NOT but found " + current.describe());
    }

    /**
     * Drains the remaining tokens, telling whether any variable or operator is left.
     */
    private boolean restIsEmpty() {
        Token token = current;
        while (!token.is(TokenType.END_OF_INPUT)) {
            if (token.is(TokenType.VARIABLE) || token.is(TokenType.OPERATOR)) {
                return false;
            }
            token = tokens.get();
        }
        return true;
    }

    private void enter(Token token) {
        if (++depth > maxNestingDepth) {
            throw new ParseException(ParseException.Kind.NESTING_TOO_DEEP, token.position(),
                    "more than " + maxNestingDepth + " nested levels");
        }
    }

    private void leave() {
        depth--;
    }

    private void advance() {
        current = tokens.get();
        if (current.is(TokenType.OPERATOR)) {
            operatorCount++;
        }
    }
}
