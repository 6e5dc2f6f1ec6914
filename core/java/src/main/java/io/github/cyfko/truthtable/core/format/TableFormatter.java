package io.github.cyfko.truthtable.core.format;

import io.github.cyfko.truthtable.core.api.TableRow;
import io.github.cyfko.truthtable.core.api.TruthTable;

import java.util.List;
import java.util.Objects;

/**
 * Renders truth table rows as a bordered text table.
 * <p>
 * Layout for {@code A && B}:
 * </p>
 * <pre>
 * ------------
 * |A|B|A &amp;&amp; B|
 * ------------
 * |0|0|     0|
 * ------------
 * |0|1|     0|
 * ------------
 * |1|0|     0|
 * ------------
 * |1|1|     1|
 * ------------
 * </pre>
 * <ul>
 *   <li>The header lists each variable, then the verbatim expression text</li>
 *   <li>Each variable column is as wide as the variable name</li>
 *   <li>The result column is as wide as the expression text</li>
 *   <li>Values are right-justified; widths count code points</li>
 *   <li>A separator line as wide as the header precedes the header, follows it, and follows every row</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TableFormatter {

    private static final char BORDER = '|';
    private static final char SEPARATOR = '-';
    private static final String NEWLINE = "\n";

    private TableFormatter() {
        // Utility class - prevent instantiation
    }

    public static String format(TruthTable table) {
        Objects.requireNonNull(table, "table cannot be null");
        return format(table.variables().names(), table.expressionText(), table.rows());
    }

    /**
     * @param variableNames  column headers, in table column order
     * @param expressionText header of the result column
     * @param rows           rows in index order
     * @return the rendered table, every line terminated by {@code \n}
     */
    public static String format(List<String> variableNames, String expressionText, List<TableRow> rows) {
        Objects.requireNonNull(variableNames, "variableNames cannot be null");
        Objects.requireNonNull(expressionText, "expressionText cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");

        int[] widths = new int[variableNames.size()];
        StringBuilder header = new StringBuilder().append(BORDER);
        for (int i = 0; i < variableNames.size(); i++) {
            String name = variableNames.get(i);
            widths[i] = Math.max(1, displayWidth(name));
            header.append(padLeft(name, widths[i])).append(BORDER);
        }
        int resultWidth = Math.max(1, displayWidth(expressionText));
        header.append(padLeft(expressionText, resultWidth)).append(BORDER);

        String separator = String.valueOf(SEPARATOR).repeat(displayWidth(header));

        StringBuilder out = new StringBuilder();
        out.append(separator).append(NEWLINE);
        out.append(header).append(NEWLINE);
        out.append(separator).append(NEWLINE);

        for (TableRow row : rows) {
            out.append(BORDER);
            for (int column = 0; column < widths.length; column++) {
                out.append(padLeft(Integer.toString(row.bit(column)), widths[column])).append(BORDER);
            }
            out.append(padLeft(Integer.toString(row.resultBit()), resultWidth)).append(BORDER).append(NEWLINE);
            out.append(separator).append(NEWLINE);
        }
        return out.toString();
    }

    private static int displayWidth(CharSequence text) {
        return Character.codePointCount(text, 0, text.length());
    }

    private static String padLeft(String value, int width) {
        int padding = width - displayWidth(value);
        return padding > 0 ? " ".repeat(padding) + value : value;
    }
}
