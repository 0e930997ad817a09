package io.fanlog.format;

import io.fanlog.Severity;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Turns a log payload into display text.
 *
 * <p>The registry calls {@link #formatBody(Object)} and {@link #formatLine} exactly once per
 * log call and hands the results to every destination.
 *
 * @see DefaultMessageFormatter
 */
public interface MessageFormatter {

    /**
     * Renders the payload of a log call.
     *
     * @param payload the raw message, may be null
     * @return the body text, never null
     */
    String formatBody(Object payload);

    /**
     * Composes the full line written by text sinks.
     *
     * @param timestamp  creation time of the entry
     * @param level      severity of the entry
     * @param body       the result of {@link #formatBody(Object)}
     * @param timeFormat formatter for the timestamp, zone already applied
     * @return {@code "<timestamp> [<short code>] <body>"}
     */
    default String formatLine(Instant timestamp, Severity level, String body, DateTimeFormatter timeFormat) {
        return timeFormat.format(timestamp) + " [" + level.shortCode() + "] " + body;
    }
}
