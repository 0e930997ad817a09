package io.fanlog.spi;

import io.fanlog.Severity;

import java.io.IOException;

/**
 * Bridge to a platform event log (Windows Event Log, syslog, journald, ...).
 *
 * <p>Implementations may throw; the calling destination absorbs the failure.
 *
 * @see io.fanlog.destination.EventLogDestination
 */
@FunctionalInterface
public interface EventLogWriter {

    /**
     * Writes one event.
     *
     * @param source   event source, the application name
     * @param message  formatted body of the entry
     * @param category coarse category mapped from the entry's severity
     * @throws IOException if the event log cannot be reached
     */
    void write(String source, String message, Severity.Category category) throws IOException;
}
