package io.github.cyfko.truthtable.core.parsing;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    VARIABLE,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    END_OF_INPUT
}
