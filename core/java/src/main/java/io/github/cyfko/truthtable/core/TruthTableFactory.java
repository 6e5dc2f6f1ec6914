package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.api.TruthTableGenerator;
import io.github.cyfko.truthtable.core.config.TruthTablePolicy;
import io.github.cyfko.truthtable.core.evaluation.TableBuilder;
import io.github.cyfko.truthtable.core.exception.TruthTableException;
import io.github.cyfko.truthtable.core.format.TableFormatter;
import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;
import io.github.cyfko.truthtable.core.utils.ExpressionPrinter;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade wiring parsing, table building and formatting together.
 *
 * <p><strong>Architecture Overview:</strong></p>
 * <ol>
 *   <li><strong>Parse:</strong> text to tree and variables using an {@link ExpressionParser}</li>
 *   <li><strong>Check:</strong> variable count against the {@link TruthTablePolicy}</li>
 *   <li><strong>Build:</strong> evaluate every assignment with a {@link TableBuilder}</li>
 *   <li><strong>Format:</strong> render rows with {@link TableFormatter}</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * TruthTableGenerator generator = TruthTableFactory.of();
 * System.out.print(generator.render("A && B"));
 *
 * TruthTable table = TruthTableFactory.of(TruthTablePolicy.strict()).generate("p -> q");
 * List<Long> minterms = table.minterms();
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link io.github.cyfko.truthtable.core.exception.LexException} - unrecognized character</li>
 *   <li>{@link io.github.cyfko.truthtable.core.exception.ParseException} - invalid syntax</li>
 *   <li>{@link io.github.cyfko.truthtable.core.exception.TableException} - too many variables</li>
 *   <li>{@link io.github.cyfko.truthtable.core.exception.ExpressionTooLongException} - text over the length limit</li>
 * </ul>
 *
 * <p>Generators are stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableFactory {

    private TruthTableFactory() {}

    /**
     * Creates a generator with the default parser and {@link TruthTablePolicy#defaults()}.
     *
     * @return a new generator
     */
    public static TruthTableGenerator of() {
        return of(TruthTablePolicy.defaults());
    }

    /**
     * Creates a generator enforcing the given policy.
     *
     * @param policy limits for expression length, nesting and variable count
     * @return a new generator
     * @throws NullPointerException if policy is null
     */
    public static TruthTableGenerator of(TruthTablePolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        return of(new BasicExpressionParser(policy), policy);
    }

    /**
     * Creates a generator with a custom parser.
     *
     * @param parser the parser turning text into trees
     * @param policy limits applied when building the table
     * @return a new generator
     * @throws NullPointerException if parser or policy is null
     */
    public static TruthTableGenerator of(ExpressionParser parser, TruthTablePolicy policy) {
        Objects.requireNonNull(parser, "parser cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        return new DefaultTruthTableGenerator(parser, new TableBuilder(policy));
    }

    private record DefaultTruthTableGenerator(ExpressionParser parser, TableBuilder builder) implements TruthTableGenerator {

        private static final Logger log = Logger.getLogger(DefaultTruthTableGenerator.class.getName());

        @Override
        public TruthTable generate(String text) throws TruthTableException {
            Objects.requireNonNull(text, "text cannot be null");

            ParsedExpression parsed = parser.parse(text);
            log.fine(() -> String.format(
                    "Parsed expression '%s': variables=%s, postfix=%s",
                    text,
                    parsed.variables(),
                    String.join(" ", ExpressionPrinter.toPostfix(parsed.expression()))
            ));

            long start = System.nanoTime();
            TruthTable table = builder.build(parsed, text);
            long durationMs = (System.nanoTime() - start) / 1_000_000;

            log.fine(() -> String.format(
                    "Truth table built: %d row(s) in %d ms",
                    table.size(),
                    durationMs
            ));

            return table;
        }

        @Override
        public String render(String text) throws TruthTableException {
            return TableFormatter.format(generate(text));
        }
    }
}
