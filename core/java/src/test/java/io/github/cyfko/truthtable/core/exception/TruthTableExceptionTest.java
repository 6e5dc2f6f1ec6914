package io.github.cyfko.truthtable.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for the diagnostics rendered by {@link TruthTableException#describe(String)}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("TruthTableException Tests")
class TruthTableExceptionTest {

    private static final String NL = System.lineSeparator();

    @Test
    @DisplayName("Caret points at the offending column")
    void testCaret() {
        LexException exception = new LexException('$', 5);

        String expected = "[ERROR]: A && $B" + NL
                + "              ^" + NL
                + "[ERROR]: Unrecognized character '$' at position 5";
        assertEquals(expected, exception.describe("A && $B"));
    }

    @Test
    @DisplayName("Caret may sit one past the last character")
    void testCaretAtEnd() {
        ParseException exception = new ParseException(ParseException.Kind.MISSING_OPERAND, 4, "expected an operand");

        String[] lines = exception.describe("A &&").split(NL);

        assertEquals(3, lines.length);
        assertEquals(" ".repeat(13) + "^", lines[1]);
        assertEquals("[ERROR]: Missing operand at position 4: expected an operand", lines[2]);
    }

    @Test
    @DisplayName("Caret column counts code points")
    void testCaretCodePoints() {
        LexException exception = new LexException('#', 3);

        String[] lines = exception.describe("¬A #").split(NL);

        assertEquals(" ".repeat(12) + "^", lines[1]);
    }

    @Test
    @DisplayName("Errors without a position render a single line")
    void testNoPosition() {
        TableException exception = TableException.tooManyVariables(30, 20, "DEFAULT_POLICY");

        assertFalse(exception.hasPosition());
        assertEquals("[ERROR]: Too many variables (30, max: 20). Policy applied: DEFAULT_POLICY",
                exception.describe("ignored"));
    }

    @Test
    @DisplayName("Positions past the source render a single line")
    void testPositionPastSource() {
        ExpressionTooLongException exception = new ExpressionTooLongException(12, 10, "CUSTOM_POLICY");

        assertEquals(10, exception.getPosition());
        assertEquals("[ERROR]: " + exception.getMessage(), exception.describe("short"));
    }

    @Test
    @DisplayName("Length errors put the caret under the first character past the limit")
    void testTooLongCaret() {
        ExpressionTooLongException exception = new ExpressionTooLongException(11, 10, "CUSTOM_POLICY");

        String[] lines = exception.describe("A && B && C").split(NL);

        assertEquals(3, lines.length);
        assertEquals(" ".repeat(9 + 10) + "^", lines[1]);
        assertEquals('C', "A && B && C".charAt(exception.getPosition()));
        assertEquals("[ERROR]: Expression too long (11 characters, max: 10). Policy applied: CUSTOM_POLICY", lines[2]);
    }

    @Test
    @DisplayName("Parse messages carry the kind label")
    void testParseMessage() {
        ParseException exception = new ParseException(ParseException.Kind.UNMATCHED_PAREN, 0, "'(' is never closed");

        assertEquals("Unmatched parenthesis at position 0: '(' is never closed", exception.getMessage());
        assertEquals(ParseException.Kind.UNMATCHED_PAREN, exception.getKind());
    }

    @Test
    @DisplayName("Every error is a TruthTableException")
    void testHierarchy() {
        assertInstanceOf(TruthTableException.class, new LexException('@', 0));
        assertInstanceOf(TruthTableException.class, EvaluationException.missingVariable("A"));
        assertInstanceOf(RuntimeException.class, TableException.tooManyVariables(21, 20, "P"));
    }
}
