package io.fanlog.destination;

import io.fanlog.LogEntry;
import io.fanlog.Severity;
import io.fanlog.util.Arguments;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Publishes the full line verbatim to a {@code java.util.logging} logger, the JVM's trace
 * stream. Handlers and levels configured for that logger decide where the line ends up.
 *
 * <p>Severities map to {@link Level#FINE}, {@link Level#INFO}, {@link Level#WARNING} and
 * {@link Level#SEVERE} (error and critical).
 */
public final class TraceDestination extends AbstractDestination {
    public static final String DEFAULT_LOGGER_NAME = "fanlog.trace";

    private final Logger traceLogger;

    public TraceDestination(String identifier) {
        this(identifier, Severity.DEBUG);
    }

    public TraceDestination(String identifier, Severity minimumLevel) {
        this(identifier, minimumLevel, DEFAULT_LOGGER_NAME);
    }

    public TraceDestination(String identifier, Severity minimumLevel, String loggerName) {
        super(identifier, minimumLevel);
        this.traceLogger = Logger.getLogger(Arguments.requireNonEmpty(loggerName, "loggerName"));
    }

    @Override
    protected void append(LogEntry entry) {
        LogRecord record = new LogRecord(toJulLevel(entry.level()), entry.fullLine());
        record.setLoggerName(traceLogger.getName());
        record.setInstant(entry.timestamp());
        traceLogger.log(record);
    }

    static Level toJulLevel(Severity severity) {
        switch (severity) {
            case DEBUG:
                return Level.FINE;
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARNING;
            default:
                return Level.SEVERE;
        }
    }
}
