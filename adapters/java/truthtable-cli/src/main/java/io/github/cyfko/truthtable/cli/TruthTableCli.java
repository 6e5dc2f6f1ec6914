package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.TruthTableFactory;
import io.github.cyfko.truthtable.core.api.TruthTableGenerator;
import io.github.cyfko.truthtable.core.config.TruthTablePolicy;
import io.github.cyfko.truthtable.core.exception.TruthTableException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point printing the truth table of a boolean expression.
 * <p>
 * The expression comes from {@code --expression}, positional words, {@code --file} or the
 * first line of standard input, in that order of preference. It is trimmed before parsing.
 * </p>
 *
 * <p><strong>Exit status:</strong></p>
 * <ul>
 *   <li>{@value #EXIT_OK}: table printed</li>
 *   <li>{@value #EXIT_EXPRESSION_ERROR}: the expression could not be tabulated; the diagnostic is on stderr</li>
 *   <li>{@value #EXIT_USAGE_ERROR}: bad command line or unreadable input</li>
 * </ul>
 *
 * <pre>
 * $ truthtable 'A &amp;&amp; B'
 * $ echo '!A || B' | truthtable
 * $ truthtable --policy strict -f expression.txt
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_EXPRESSION_ERROR = 1;
    public static final int EXIT_USAGE_ERROR = 2;

    private static final String LOGGING_CONFIG = "/logging.properties";
    private static final String ROOT_LOGGER = "io.github.cyfko.truthtable";

    private static final Logger log = Logger.getLogger(TruthTableCli.class.getName());
    // Strong reference for the level set by --verbose.
    private static final Logger rootLogger = Logger.getLogger(ROOT_LOGGER);

    private final Function<TruthTablePolicy, TruthTableGenerator> generators;

    public TruthTableCli() {
        this(TruthTableFactory::of);
    }

    /**
     * @param generators creates the generator for the policy selected on the command line
     */
    public TruthTableCli(Function<TruthTablePolicy, TruthTableGenerator> generators) {
        this.generators = Objects.requireNonNull(generators, "generators cannot be null");
    }

    public static void main(String[] args) {
        configureLogging();
        int status = new TruthTableCli().run(args, System.in, System.out, System.err);
        System.exit(status);
    }

    /**
     * Runs the program.
     *
     * @param args program arguments
     * @param in   standard input
     * @param out  where the table is printed
     * @param err  where diagnostics are printed
     * @return the exit status
     */
    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (CliUsageException e) {
            err.println("[ERROR]: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE_ERROR;
        }

        if (options.showHelp()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }
        if (options.showGrammar()) {
            out.print(GrammarHelp.render());
            return EXIT_OK;
        }
        if (options.verbose()) {
            rootLogger.setLevel(Level.FINE);
        }

        String text;
        try {
            text = readExpression(options, in).trim();
        } catch (IOException e) {
            log.log(Level.FINE, "Failed to read expression", e);
            err.println("[ERROR]: Cannot read expression: " + e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        try {
            out.print(generators.apply(options.policy()).render(text));
            out.flush();
            return EXIT_OK;
        } catch (TruthTableException e) {
            log.fine(() -> String.format("Rejected expression '%s': %s", text, e.getMessage()));
            err.println(e.describe(text));
            return EXIT_EXPRESSION_ERROR;
        }
    }

    private static String readExpression(CliOptions options, InputStream in) throws IOException {
        if (options.readsStandardInput()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line = reader.readLine();
            return line == null ? "" : line;
        }
        if (options.file() != null) {
            List<String> lines = Files.readAllLines(options.file(), StandardCharsets.UTF_8);
            return lines.stream().filter(line -> !line.isBlank()).findFirst().orElse("");
        }
        return options.expression();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = TruthTableCli.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Cannot load " + LOGGING_CONFIG + ", using JVM logging defaults", e);
        }
    }
}
