package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.ExpressionTooLongException;
import io.github.cyfko.truthtable.core.exception.LexException;
import io.github.cyfko.truthtable.core.exception.ParseException;

/**
 * Interface for parsing boolean expression text into an evaluable tree.
 * <p>
 * Implementations honor operator precedence ({@code NOT > AND > OR > XOR > IMPLIES > IFF}),
 * left associativity of binary operators and parentheses, and collect the distinct
 * variables in first-occurrence order.
 * </p>
 *
 * <p><strong>Valid Expression Examples:</strong></p>
 * <pre>{@code
 * parser.parse("A");                  // single variable
 * parser.parse("A && B");             // AND
 * parser.parse("!A || B");            // NOT binds tighter than OR
 * parser.parse("(A AND B) OR C");     // word spellings
 * parser.parse("p -> q <-> !p || q"); // implication and biconditional
 * }</pre>
 *
 * <p><strong>Invalid Expression Examples:</strong></p>
 * <pre>{@code
 * parser.parse("");          // EMPTY_EXPRESSION
 * parser.parse("A &&");      // MISSING_OPERAND
 * parser.parse("((A)");      // UNMATCHED_PAREN
 * parser.parse("A B");       // UNEXPECTED_TOKEN
 * parser.parse("A $ B");     // LexException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * Parses an expression.
     *
     * @param text the expression text; whitespace is insignificant
     * @return the expression tree and its variables
     * @throws LexException                if the text contains an unrecognized character
     * @throws ParseException              if the tokens do not form a valid expression
     * @throws ExpressionTooLongException  if the text exceeds the configured length
     * @throws NullPointerException        if text is null
     */
    ParsedExpression parse(String text) throws LexException, ParseException, ExpressionTooLongException;
}
