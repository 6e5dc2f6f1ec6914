package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.config.TruthTablePolicy;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line of the {@code truthtable} program.
 *
 * @param expression   expression text given with {@code -e} or as positional words, or {@code null}
 * @param file         file to read the expression from, or {@code null}
 * @param policy       limits to apply
 * @param showGrammar  print the grammar and exit
 * @param showHelp     print usage and exit
 * @param verbose      enable FINE logging
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CliOptions(
        String expression,
        Path file,
        TruthTablePolicy policy,
        boolean showGrammar,
        boolean showHelp,
        boolean verbose
) {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: truthtable [options] [expression...]",
            "",
            "Prints the truth table of a boolean expression. Without an expression argument",
            "the first line of standard input is read.",
            "",
            "Options:",
            "  -e, --expression <text>   expression to tabulate",
            "  -f, --file <path>         read the expression from a UTF-8 file (first non-blank line)",
            "  -m, --max-variables <n>   maximum number of distinct variables",
            "  -p, --policy <name>       limits preset: default, strict or relaxed",
            "  -g, --grammar             print the accepted grammar and exit",
            "  -v, --verbose             log parsing and evaluation details",
            "  -h, --help                print this help and exit");

    /**
     * @return {@code true} when neither an expression nor a file was given, so stdin must be read
     */
    public boolean readsStandardInput() {
        return expression == null && file == null;
    }

    /**
     * Parses program arguments.
     *
     * @param args the raw arguments
     * @return the options
     * @throws CliUsageException on unknown options, missing or invalid values, or conflicting sources
     */
    public static CliOptions parse(String[] args) throws CliUsageException {
        String expression = null;
        Path file = null;
        String policyName = null;
        Integer maxVariables = null;
        boolean grammar = false;
        boolean help = false;
        boolean verbose = false;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-e", "--expression" -> expression = valueOf(args, ++i, arg);
                case "-f", "--file" -> file = toPath(valueOf(args, ++i, arg), arg);
                case "-p", "--policy" -> policyName = valueOf(args, ++i, arg);
                case "-m", "--max-variables" -> maxVariables = parsePositiveInt(valueOf(args, ++i, arg), arg);
                case "-g", "--grammar" -> grammar = true;
                case "-v", "--verbose" -> verbose = true;
                case "-h", "--help" -> help = true;
                case "--" -> {
                    for (int j = i + 1; j < args.length; j++) {
                        positional.add(args[j]);
                    }
                    i = args.length;
                }
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1 && !arg.startsWith("->")) {
                        throw new CliUsageException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }

        if (!positional.isEmpty()) {
            if (expression != null) {
                throw new CliUsageException("Expression given both with --expression and as arguments");
            }
            expression = String.join(" ", positional);
        }
        if (expression != null && file != null) {
            throw new CliUsageException("Options --expression and --file are mutually exclusive");
        }

        TruthTablePolicy policy;
        try {
            policy = policyName == null ? TruthTablePolicy.defaults() : TruthTablePolicy.named(policyName);
            if (maxVariables != null) {
                policy = policy.toBuilder().maxVariables(maxVariables).build();
            }
        } catch (IllegalArgumentException e) {
            throw new CliUsageException(e.getMessage(), e);
        }

        return new CliOptions(expression, file, policy, grammar, help, verbose);
    }

    private static String valueOf(String[] args, int index, String option) throws CliUsageException {
        if (index >= args.length) {
            throw new CliUsageException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static Path toPath(String value, String option) throws CliUsageException {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new CliUsageException("Option " + option + " requires a valid path, got: " + value, e);
        }
    }

    private static int parsePositiveInt(String value, String option) throws CliUsageException {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new CliUsageException("Option " + option + " requires a positive number, got: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new CliUsageException("Option " + option + " requires a number, got: " + value, e);
        }
    }
}
