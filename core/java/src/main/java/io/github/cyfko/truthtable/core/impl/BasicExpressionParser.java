package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.config.TruthTablePolicy;
import io.github.cyfko.truthtable.core.exception.ExpressionTooLongException;
import io.github.cyfko.truthtable.core.parsing.Lexer;
import io.github.cyfko.truthtable.core.parsing.PrecedenceParser;

import java.util.Objects;

/**
 * Default {@link ExpressionParser}: lazy {@link Lexer} feeding a {@link PrecedenceParser}.
 * <p>
 * The parser supports the following logical operators:
 * </p>
 * <ul>
 *   <li>! NOT ¬ (NOT) - precedence: 6, associativity: right</li>
 *   <li>&amp;&amp; &amp; AND ∧ (AND) - precedence: 5, associativity: left</li>
 *   <li>|| | OR ∨ (OR) - precedence: 4, associativity: left</li>
 *   <li>^ XOR ⊕ (XOR) - precedence: 3, associativity: left</li>
 *   <li>-&gt; =&gt; IMPLIES → (IMPLIES) - precedence: 2, associativity: left</li>
 *   <li>&lt;-&gt; &lt;=&gt; IFF ↔ (IFF) - precedence: 1, associativity: left</li>
 * </ul>
 * as well as parentheses for managing priorities.
 *
 * <h2>Complexity Limits</h2>
 * <p>
 * The parser enforces the limits of its {@link TruthTablePolicy}:
 * </p>
 * <ul>
 *   <li><strong>Expression Length</strong>: rejected before lexing</li>
 *   <li><strong>Nesting Depth</strong>: rejected while parsing</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * ParsedExpression parsed = parser.parse("!(A && B) || C");
 *
 * ExpressionParser strictParser = new BasicExpressionParser(TruthTablePolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private final TruthTablePolicy policy;

    /**
     * Default constructor using {@link TruthTablePolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(TruthTablePolicy.defaults());
    }

    /**
     * @param policy the limits to enforce
     * @throws IllegalArgumentException if policy is null
     */
    public BasicExpressionParser(TruthTablePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Truth table policy is required");
        }
        this.policy = policy;
    }

    @Override
    public ParsedExpression parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");

        if (text.length() > policy.maxExpressionLength()) {
            throw new ExpressionTooLongException(text.length(), policy.maxExpressionLength(), policy.policyName());
        }

        return PrecedenceParser.parse(new Lexer(text), policy.maxNestingDepth());
    }

    public TruthTablePolicy getPolicy() {
        return policy;
    }
}
