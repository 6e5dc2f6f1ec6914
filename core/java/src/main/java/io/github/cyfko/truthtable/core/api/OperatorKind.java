package io.github.cyfko.truthtable.core.api;

import java.util.List;
import java.util.Optional;

/**
 * Enumeration of the boolean connectives understood by the expression grammar.
 * <p>
 * Each operator has a fixed arity, precedence and associativity, and a set of accepted
 * spellings in three registers: symbolic, upper-case word and mathematical symbol.
 * </p>
 *
 * <table>
 *   <caption>Precedence (highest first)</caption>
 *   <tr><th>Operator</th><th>Precedence</th><th>Associativity</th><th>Spellings</th></tr>
 *   <tr><td>NOT</td><td>6</td><td>right (prefix)</td><td>{@code ! NOT ¬}</td></tr>
 *   <tr><td>AND</td><td>5</td><td>left</td><td>{@code && & AND ∧}</td></tr>
 *   <tr><td>OR</td><td>4</td><td>left</td><td>{@code || | OR ∨}</td></tr>
 *   <tr><td>XOR</td><td>3</td><td>left</td><td>{@code ^ XOR ⊕}</td></tr>
 *   <tr><td>IMPLIES</td><td>2</td><td>left</td><td>{@code -> => IMPLIES →}</td></tr>
 *   <tr><td>IFF</td><td>1</td><td>left</td><td>{@code <-> <=> IFF ↔}</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorKind {

    /**
     * Logical negation.
     */
    NOT(1, 6, Associativity.RIGHT, "!", List.of("!", "NOT", "¬")),

    /**
     * Logical conjunction.
     */
    AND(2, 5, Associativity.LEFT, "&&", List.of("&&", "&", "AND", "∧")),

    /**
     * Logical disjunction.
     */
    OR(2, 4, Associativity.LEFT, "||", List.of("||", "|", "OR", "∨")),

    /**
     * Exclusive disjunction.
     */
    XOR(2, 3, Associativity.LEFT, "^", List.of("^", "XOR", "⊕")),

    /**
     * Material implication, {@code a -> b} is {@code !a || b}.
     */
    IMPLIES(2, 2, Associativity.LEFT, "->", List.of("->", "=>", "IMPLIES", "→")),

    /**
     * Biconditional, true when both sides are equal.
     */
    IFF(2, 1, Associativity.LEFT, "<->", List.of("<->", "<=>", "IFF", "↔"));

    public enum Associativity {
        LEFT,
        RIGHT
    }

    private final int arity;
    private final int precedence;
    private final Associativity associativity;
    private final String symbol;
    private final List<String> spellings;

    OperatorKind(int arity, int precedence, Associativity associativity, String symbol, List<String> spellings) {
        this.arity = arity;
        this.precedence = precedence;
        this.associativity = associativity;
        this.symbol = symbol;
        this.spellings = spellings;
    }

    public int getArity() {
        return arity;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * @return the canonical symbolic spelling used when printing expressions
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return every spelling the lexer accepts for this operator
     */
    public List<String> getSpellings() {
        return spellings;
    }

    /**
     * Applies a binary operator to two evaluated operands.
     *
     * @param left  value of the left operand
     * @param right value of the right operand
     * @return the combined value
     * @throws UnsupportedOperationException if called on {@link #NOT}
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left ^ right;
            case IMPLIES -> !left || right;
            case IFF -> left == right;
            case NOT -> throw new UnsupportedOperationException("NOT is a unary operator");
        };
    }

    /**
     * Finds the operator spelled by an upper-case keyword such as {@code AND} or {@code IMPLIES}.
     *
     * @param word a complete name run read by the lexer
     * @return the operator, or empty if the word is an ordinary variable name
     */
    public static Optional<OperatorKind> fromKeyword(String word) {
        for (OperatorKind kind : values()) {
            if (kind.name().equals(word)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
