package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.api.OperatorKind;

import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Text printed by {@code truthtable --grammar}, generated from {@link OperatorKind} so it
 * always lists the spellings the lexer accepts.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class GrammarHelp {

    private GrammarHelp() {}

    static String render() {
        String nl = System.lineSeparator();
        StringBuilder out = new StringBuilder();
        out.append("Grammar (highest precedence first):").append(nl);
        out.append(nl);
        out.append("  expr         := iff_expr").append(nl);
        out.append("  iff_expr     := implies_expr (IFF implies_expr)*").append(nl);
        out.append("  implies_expr := xor_expr (IMPLIES xor_expr)*").append(nl);
        out.append("  xor_expr     := or_expr (XOR or_expr)*").append(nl);
        out.append("  or_expr      := and_expr (OR and_expr)*").append(nl);
        out.append("  and_expr     := unary (AND unary)*").append(nl);
        out.append("  unary        := NOT unary | primary").append(nl);
        out.append("  primary      := VARIABLE | '(' expr ')'").append(nl);
        out.append(nl);
        out.append("Operators:").append(nl);

        Stream.of(OperatorKind.values())
                .sorted(Comparator.comparingInt(OperatorKind::getPrecedence).reversed())
                .forEach(kind -> out.append(String.format("  %-8s precedence %d, %-5s  %s%n",
                        kind.name(),
                        kind.getPrecedence(),
                        kind.isUnary() ? "unary" : "left",
                        String.join("  ", kind.getSpellings()))));

        out.append(nl);
        out.append("Variables: a letter followed by letters or digits, case-sensitive.").append(nl);
        out.append("Upper-case operator words (NOT, AND, OR, XOR, IMPLIES, IFF) are reserved.").append(nl);
        return out.toString();
    }
}
