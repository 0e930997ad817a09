package io.fanlog;

import java.time.Instant;
import java.util.Objects;

/**
 * One log call, formatted once and shared read-only by every destination in the fan-out.
 *
 * @param timestamp     creation time
 * @param level         severity of the call
 * @param message       the raw payload passed by the caller, may be null
 * @param formattedBody payload rendered as text
 * @param fullLine      {@code "<timestamp> [<code>] <body>"}
 * @param identity      process identity for identity-aware sinks
 */
public record LogEntry(Instant timestamp,
                       Severity level,
                       Object message,
                       String formattedBody,
                       String fullLine,
                       ProcessIdentity identity) {

    public LogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(formattedBody, "formattedBody");
        Objects.requireNonNull(fullLine, "fullLine");
        Objects.requireNonNull(identity, "identity");
    }

    @Override
    public String toString() {
        return "LogEntry: " + timestamp + " | " + level + " | " + message;
    }
}
