package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.api.TableRow;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.api.TruthTableGenerator;
import io.github.cyfko.truthtable.core.api.VariableSet;
import io.github.cyfko.truthtable.core.config.TruthTablePolicy;
import io.github.cyfko.truthtable.core.exception.LexException;
import io.github.cyfko.truthtable.core.exception.ParseException;
import io.github.cyfko.truthtable.core.exception.TableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.github.cyfko.truthtable.core.api.Expression.and;
import static io.github.cyfko.truthtable.core.api.Expression.variable;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for generators created by {@link TruthTableFactory}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("TruthTableFactory Tests")
class TruthTableFactoryTest {

    @Mock
    private ExpressionParser mockParser;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private static List<Boolean> results(TruthTable table) {
        return table.rows().stream().map(TableRow::result).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Default generator")
    class DefaultGenerator {

        private final TruthTableGenerator generator = TruthTableFactory.of();

        @Test
        @DisplayName("Renders A && B")
        void testRenderAnd() {
            String output = generator.render("A && B");

            assertTrue(output.startsWith("------------\n|A|B|A && B|\n------------\n"));
            assertTrue(output.endsWith("|1|1|     1|\n------------\n"));
        }

        @Test
        @DisplayName("Output is deterministic")
        void testDeterministic() {
            String text = "(a ^ b) -> !(c <-> a)";

            assertEquals(generator.render(text), generator.render(text));
        }

        @Test
        @DisplayName("Equivalent expressions have identical result columns")
        void testEquivalence() {
            TruthTable expanded = generator.generate("(A && B) || (A && C)");
            TruthTable factored = generator.generate("A && (B || C)");

            assertEquals(8, expanded.size());
            assertEquals(results(factored), results(expanded));
        }

        @Test
        @DisplayName("Errors from every stage propagate")
        void testErrors() {
            assertThrows(LexException.class, () -> generator.render("A @ B"));
            assertThrows(ParseException.class, () -> generator.render("(A"));

            String wide = IntStream.range(0, 21)
                    .mapToObj(i -> "v" + i)
                    .collect(Collectors.joining(" & "));
            assertThrows(TableException.class, () -> generator.render(wide));
        }

        @Test
        @DisplayName("Longest chain accepted by the relaxed policy is tabulated")
        void testRelaxedLongChain() {
            String text = "A" + "&A".repeat(4999);
            TruthTableGenerator relaxed = TruthTableFactory.of(TruthTablePolicy.relaxed());

            TruthTable table = relaxed.generate(text);

            assertEquals(9999, text.length());
            assertEquals(List.of(false, true), results(table));
            assertTrue(relaxed.render(text).endsWith("|1|" + " ".repeat(9998) + "1|\n" + "-".repeat(10003) + "\n"));
        }

        @Test
        @DisplayName("Chain far beyond the thread stack depth is tabulated")
        void testVeryLongChain() {
            String text = "A" + " OR A".repeat(200_000);
            TruthTablePolicy large = TruthTablePolicy.builder().maxExpressionLength(2_000_000).build();

            TruthTable table = TruthTableFactory.of(large).generate(text);

            assertEquals(List.of(false, true), results(table));
        }

        @Test
        @DisplayName("Null text is rejected")
        void testNullText() {
            assertThrows(NullPointerException.class, () -> generator.generate(null));
        }
    }

    @Nested
    @DisplayName("Custom parser")
    class CustomParser {

        @Test
        @DisplayName("Generator delegates parsing to the given parser")
        void testDelegation() {
            ParsedExpression parsed = new ParsedExpression(and(variable("x"), variable("y")), VariableSet.of("x", "y"));
            when(mockParser.parse("anything")).thenReturn(parsed);

            TruthTable table = TruthTableFactory.of(mockParser, TruthTablePolicy.defaults()).generate("anything");

            verify(mockParser, times(1)).parse("anything");
            assertEquals("anything", table.expressionText());
            assertEquals(List.of(false, false, false, true), results(table));
        }

        @Test
        @DisplayName("Variable cap of the policy applies to custom parsers")
        void testPolicyApplied() {
            ParsedExpression parsed = new ParsedExpression(and(variable("x"), variable("y")), VariableSet.of("x", "y"));
            when(mockParser.parse(anyString())).thenReturn(parsed);
            TruthTablePolicy oneVariable = TruthTablePolicy.builder().maxVariables(1).build();

            assertThrows(TableException.class,
                    () -> TruthTableFactory.of(mockParser, oneVariable).generate("x && y"));
        }

        @Test
        @DisplayName("Parser errors reach the caller unchanged")
        void testParserError() {
            ParseException failure = new ParseException(ParseException.Kind.EMPTY_EXPRESSION, 0, null);
            when(mockParser.parse("")).thenThrow(failure);

            ParseException thrown = assertThrows(ParseException.class,
                    () -> TruthTableFactory.of(mockParser, TruthTablePolicy.defaults()).render(""));
            assertSame(failure, thrown);
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void testNullArguments() {
            assertThrows(NullPointerException.class, () -> TruthTableFactory.of(null, TruthTablePolicy.defaults()));
            assertThrows(NullPointerException.class, () -> TruthTableFactory.of(mockParser, null));
            assertThrows(NullPointerException.class, () -> TruthTableFactory.of((TruthTablePolicy) null));
        }
    }
}
