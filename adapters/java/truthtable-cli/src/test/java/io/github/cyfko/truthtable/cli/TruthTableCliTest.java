package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.api.TruthTableGenerator;
import io.github.cyfko.truthtable.core.config.TruthTablePolicy;
import io.github.cyfko.truthtable.core.exception.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Test suite for {@link TruthTableCli}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("TruthTableCli Tests")
class TruthTableCliTest {

    private static final String AND_TABLE = ""
            + "------------\n"
            + "|A|B|A && B|\n"
            + "------------\n"
            + "|0|0|     0|\n"
            + "------------\n"
            + "|0|1|     0|\n"
            + "------------\n"
            + "|1|0|     0|\n"
            + "------------\n"
            + "|1|1|     1|\n"
            + "------------\n";

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(TruthTableCli cli, String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return cli.run(args, in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String stdin, String... args) {
        return run(new TruthTableCli(), stdin, args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Successful runs")
    class Success {

        @Test
        @DisplayName("Expression as a positional argument")
        void testPositional() {
            assertEquals(TruthTableCli.EXIT_OK, run("", "A && B"));
            assertEquals(AND_TABLE, stdout());
            assertEquals("", stderr());
        }

        @Test
        @DisplayName("Expression read from the first line of standard input, trimmed")
        void testStandardInput() {
            assertEquals(TruthTableCli.EXIT_OK, run("  A && B  \nC || D\n"));
            assertEquals(AND_TABLE, stdout());
        }

        @Test
        @DisplayName("Expression read from the first non-blank line of a file")
        void testFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("expression.txt");
            Files.writeString(file, "\n   \nA && B\nignored\n", StandardCharsets.UTF_8);

            assertEquals(TruthTableCli.EXIT_OK, run("", "--file", file.toString()));
            assertEquals(AND_TABLE, stdout());
        }

        @Test
        @DisplayName("Verbose mode keeps the table on standard output")
        void testVerbose() {
            assertEquals(TruthTableCli.EXIT_OK, run("", "-v", "-e", "A && B"));
            assertEquals(AND_TABLE, stdout());
        }

        @Test
        @DisplayName("Relaxed policy accepts its longest chain")
        void testRelaxedLongChain() {
            assertEquals(TruthTableCli.EXIT_OK, run("", "-p", "relaxed", "-e", "A" + "&A".repeat(4999)));
            assertEquals("", stderr());
            assertTrue(stdout().contains("|0|" + " ".repeat(9998) + "0|\n"));
        }

        @Test
        @DisplayName("Help goes to standard output")
        void testHelp() {
            assertEquals(TruthTableCli.EXIT_OK, run("", "--help"));
            assertTrue(stdout().startsWith("Usage: truthtable"));
        }

        @Test
        @DisplayName("Grammar lists every operator keyword")
        void testGrammar() {
            assertEquals(TruthTableCli.EXIT_OK, run("", "-g"));

            String grammar = stdout();
            assertTrue(grammar.contains("iff_expr"));
            for (String keyword : new String[]{"NOT", "AND", "OR", "XOR", "IMPLIES", "IFF"}) {
                assertTrue(grammar.contains(keyword), keyword);
            }
            assertTrue(grammar.indexOf("  NOT ") < grammar.indexOf("  IFF "));
        }
    }

    @Nested
    @DisplayName("Expression errors")
    class ExpressionErrors {

        @Test
        @DisplayName("Parse error prints a caret diagnostic and exits with 1")
        void testParseError() {
            assertEquals(TruthTableCli.EXIT_EXPRESSION_ERROR, run("", "-e", "A &&"));

            String nl = System.lineSeparator();
            assertEquals("", stdout());
            assertTrue(stderr().startsWith("[ERROR]: A &&" + nl + " ".repeat(13) + "^" + nl
                    + "[ERROR]: Missing operand at position 4"));
        }

        @Test
        @DisplayName("Lexical error exits with 1")
        void testLexError() {
            assertEquals(TruthTableCli.EXIT_EXPRESSION_ERROR, run("", "A $ B"));
            assertTrue(stderr().contains("Unrecognized character '$' at position 2"));
        }

        @Test
        @DisplayName("Empty standard input is an empty expression")
        void testEmptyInput() {
            assertEquals(TruthTableCli.EXIT_EXPRESSION_ERROR, run(""));
            assertTrue(stderr().contains("Empty expression"));
        }

        @Test
        @DisplayName("Variable cap from the command line is enforced")
        void testVariableCap() {
            assertEquals(TruthTableCli.EXIT_EXPRESSION_ERROR, run("", "-m", "2", "a && b && c"));
            assertTrue(stderr().contains("Too many variables (3, max: 2)"));
        }
    }

    @Nested
    @DisplayName("Usage errors")
    class UsageErrors {

        @Test
        @DisplayName("Unknown option prints usage to stderr and exits with 2")
        void testUnknownOption() {
            assertEquals(TruthTableCli.EXIT_USAGE_ERROR, run("", "--colour"));

            assertEquals("", stdout());
            assertTrue(stderr().startsWith("[ERROR]: Unknown option: --colour"));
            assertTrue(stderr().contains("Usage: truthtable"));
        }

        @Test
        @DisplayName("Missing file exits with 2")
        void testMissingFile(@TempDir Path dir) {
            assertEquals(TruthTableCli.EXIT_USAGE_ERROR, run("", "-f", dir.resolve("absent.txt").toString()));
            assertTrue(stderr().startsWith("[ERROR]: Cannot read expression"));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Generator wiring")
    class GeneratorWiring {

        @Mock
        private TruthTableGenerator generator;

        @Test
        @DisplayName("Selected policy is passed to the generator factory")
        void testPolicyPassed() {
            when(generator.render("x")).thenReturn("table\n");
            TruthTablePolicy[] seen = new TruthTablePolicy[1];
            TruthTableCli cli = new TruthTableCli(policy -> {
                seen[0] = policy;
                return generator;
            });

            assertEquals(TruthTableCli.EXIT_OK, run(cli, "", "--policy", "relaxed", "x"));
            assertEquals("table\n", stdout());
            assertEquals(TruthTablePolicy.relaxed(), seen[0]);
        }

        @Test
        @DisplayName("Generator failures are reported against the trimmed text")
        void testGeneratorFailure() {
            when(generator.render(any())).thenThrow(
                    new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, 2, "expected an operator or end of input but found 'y'"));
            TruthTableCli cli = new TruthTableCli(policy -> generator);

            assertEquals(TruthTableCli.EXIT_EXPRESSION_ERROR, run(cli, " x y \n"));

            verify(generator).render("x y");
            assertTrue(stderr().startsWith("[ERROR]: x y" + System.lineSeparator()));
        }

        @Test
        @DisplayName("Help never builds a generator")
        void testHelpSkipsGenerator() {
            TruthTableCli cli = new TruthTableCli(policy -> {
                throw new AssertionError("generator requested");
            });

            assertEquals(TruthTableCli.EXIT_OK, run(cli, "", "-h", "A"));
            verifyNoInteractions(generator);
        }
    }
}
