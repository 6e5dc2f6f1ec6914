package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.OperatorKind;
import io.github.cyfko.truthtable.core.exception.LexException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts expression text into a lazy sequence of {@link Token}s.
 * <p>
 * Tokens are produced on demand by {@link #nextToken()}, so a {@link LexException}
 * surfaces only when the parser actually reaches the offending character.
 * </p>
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>Whitespace is skipped</li>
 *   <li>A name is a maximal run of letters and digits starting with a letter, case-sensitive</li>
 *   <li>A name equal to an upper-case keyword ({@code NOT AND OR XOR IMPLIES IFF}) is an operator</li>
 *   <li>Symbolic operators use longest match, so {@code <->} is never read as {@code <} {@code ->}</li>
 *   <li>After the last character a single {@link TokenType#END_OF_INPUT} sentinel is returned, repeatedly</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = Lexer.tokenize("!A || B");
 * // [OPERATOR '!', VARIABLE 'A', OPERATOR '||', VARIABLE 'B', END_OF_INPUT]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    /**
     * Non-word operator spellings, longest first.
     */
    private static final List<Map.Entry<String, OperatorKind>> SYMBOLS = Stream.of(OperatorKind.values())
            .flatMap(kind -> kind.getSpellings().stream()
                    .filter(spelling -> !Character.isLetter(spelling.codePointAt(0)))
                    .map(spelling -> Map.entry(spelling, kind)))
            .sorted(Comparator.comparingInt((Map.Entry<String, OperatorKind> e) -> e.getKey().length()).reversed())
            .collect(Collectors.toUnmodifiableList());

    private final String source;
    private int cursor;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.cursor = 0;
    }

    /**
     * Tokenizes the whole text eagerly.
     *
     * @param source the expression text
     * @return every token, the last one being {@link TokenType#END_OF_INPUT}
     * @throws LexException on the first unrecognized character
     */
    public static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.END_OF_INPUT));
        return tokens;
    }

    public String source() {
        return source;
    }

    /**
     * Reads the next token.
     *
     * @return the next token, or the end-of-input sentinel once the text is exhausted
     * @throws LexException if the next non-blank character cannot start a token
     */
    public Token nextToken() {
        skipWhitespace();
        if (cursor >= source.length()) {
            return Token.endOfInput(source.length());
        }

        int start = cursor;
        int c = source.codePointAt(cursor);

        if (c == '(') {
            cursor++;
            return Token.leftParen(start);
        }
        if (c == ')') {
            cursor++;
            return Token.rightParen(start);
        }
        if (Character.isLetter(c)) {
            return readWord(start);
        }

        for (Map.Entry<String, OperatorKind> symbol : SYMBOLS) {
            if (source.startsWith(symbol.getKey(), cursor)) {
                cursor += symbol.getKey().length();
                return Token.operator(symbol.getValue(), symbol.getKey(), start);
            }
        }

        throw new LexException(c, start);
    }

    private Token readWord(int start) {
        while (cursor < source.length()) {
            int c = source.codePointAt(cursor);
            if (!Character.isLetterOrDigit(c)) break;
            cursor += Character.charCount(c);
        }
        String word = source.substring(start, cursor);
        return OperatorKind.fromKeyword(word)
                .map(kind -> Token.operator(kind, word, start))
                .orElseGet(() -> Token.variable(word, start));
    }

    private void skipWhitespace() {
        while (cursor < source.length()) {
            int c = source.codePointAt(cursor);
            if (!Character.isWhitespace(c)) break;
            cursor += Character.charCount(c);
        }
    }
}
