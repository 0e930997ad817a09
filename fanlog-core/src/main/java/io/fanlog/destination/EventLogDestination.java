package io.fanlog.destination;

import io.fanlog.LogEntry;
import io.fanlog.Severity;
import io.fanlog.spi.EventLogWriter;
import io.fanlog.util.Arguments;

import java.io.IOException;

/**
 * Writes the formatted body to the platform event log, using the application name as
 * the event source and the severity's {@linkplain Severity#category() category} as the
 * entry type.
 */
public final class EventLogDestination extends AbstractDestination {
    private final EventLogWriter writer;

    public EventLogDestination(String identifier, EventLogWriter writer) {
        this(identifier, Severity.ERROR, writer);
    }

    public EventLogDestination(String identifier, Severity minimumLevel, EventLogWriter writer) {
        super(identifier, minimumLevel);
        this.writer = Arguments.requireNonNull(writer, "writer");
    }

    @Override
    protected void append(LogEntry entry) throws IOException {
        writer.write(entry.identity().appName(), entry.formattedBody(), entry.level().category());
    }
}
