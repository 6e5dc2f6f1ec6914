package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.OperatorKind;

import java.util.Objects;

/**
 * Immutable lexical token.
 *
 * @param type     the token kind
 * @param text     the exact source text of the token, empty for {@link TokenType#END_OF_INPUT}
 * @param position 0-based character position of the first character in the source text
 * @param operator the operator for {@link TokenType#OPERATOR} tokens, {@code null} otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position, OperatorKind operator) {

    public Token {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        if ((type == TokenType.OPERATOR) != (operator != null)) {
            throw new IllegalArgumentException("Only OPERATOR tokens carry an operator kind");
        }
    }

    public static Token variable(String name, int position) {
        return new Token(TokenType.VARIABLE, name, position, null);
    }

    public static Token operator(OperatorKind kind, String spelling, int position) {
        return new Token(TokenType.OPERATOR, spelling, position, kind);
    }

    public static Token leftParen(int position) {
        return new Token(TokenType.LEFT_PAREN, "(", position, null);
    }

    public static Token rightParen(int position) {
        return new Token(TokenType.RIGHT_PAREN, ")", position, null);
    }

    public static Token endOfInput(int position) {
        return new Token(TokenType.END_OF_INPUT, "", position, null);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(OperatorKind kind) {
        return operator == kind;
    }

    /**
     * @return a short description used in diagnostics, such as {@code 'B'} or {@code end of input}
     */
    public String describe() {
        return type == TokenType.END_OF_INPUT ? "end of input" : "'" + text + "'";
    }
}
