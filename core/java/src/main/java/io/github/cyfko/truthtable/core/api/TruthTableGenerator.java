package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.TruthTableException;

/**
 * Entry point turning expression text into a truth table.
 * <p>
 * The whole pipeline is all-or-nothing: either every row is produced or a
 * {@link TruthTableException} describes the first failure.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TruthTableGenerator {

    /**
     * Parses the expression and evaluates it under every assignment.
     *
     * @param text the expression text
     * @return the complete table
     * @throws TruthTableException if the text cannot be parsed or the table exceeds the configured limits
     */
    TruthTable generate(String text) throws TruthTableException;

    /**
     * Generates the table and renders it as bordered text.
     *
     * @param text the expression text
     * @return the formatted table, one line per {@code \n}
     * @throws TruthTableException if the text cannot be parsed or the table exceeds the configured limits
     */
    String render(String text) throws TruthTableException;
}
