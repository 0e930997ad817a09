package io.fanlog.destination;

import io.fanlog.ConfigurationException;
import io.fanlog.LogEntry;
import io.fanlog.Severity;
import io.fanlog.util.Arguments;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Writes the full line to standard output.
 *
 * <p>The public constructors require an interactive process ({@link System#console()} is
 * available). Embedders that own a terminal stream may pass it explicitly.
 */
public final class ConsoleDestination extends AbstractDestination {
    private final PrintStream out;

    public ConsoleDestination(String identifier) {
        this(identifier, Severity.DEBUG);
    }

    public ConsoleDestination(String identifier, Severity minimumLevel) {
        this(identifier, minimumLevel, System.out, System.console() != null);
    }

    /**
     * @param identifier   unique key
     * @param minimumLevel initial minimum level
     * @param out          stream receiving the lines
     * @param interactive  whether the process runs in an interactive context
     * @throws ConfigurationException if {@code interactive} is false or an argument is invalid
     */
    public ConsoleDestination(String identifier, Severity minimumLevel, PrintStream out, boolean interactive) {
        super(identifier, minimumLevel);
        this.out = Arguments.requireNonNull(out, "out");
        if (!interactive) {
            throw new ConfigurationException(
                    "The process must be interactive to log to the console: " + identifier);
        }
    }

    @Override
    protected void append(LogEntry entry) throws IOException {
        out.println(entry.fullLine());
        if (out.checkError()) {
            throw new IOException("Console stream reported an error");
        }
    }
}
