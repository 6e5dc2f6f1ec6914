package io.github.cyfko.truthtable.cli;

/**
 * Exception thrown when the command line cannot be understood.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CliUsageException extends Exception {

    public CliUsageException(String message) {
        super(message);
    }

    public CliUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
