package io.fanlog.destination;

import io.fanlog.LogEntry;
import io.fanlog.ProcessIdentity;
import io.fanlog.Severity;

import java.time.Instant;

final class Entries {
    static final ProcessIdentity IDENTITY = new ProcessIdentity("billing", "host-1", "alice");
    static final Instant AT = Instant.parse("2024-05-01T10:15:30.250Z");

    private Entries() {
    }

    static LogEntry entry(Severity level, String body) {
        return new LogEntry(AT, level, body, body,
                "2024-05-01 10:15:30.250 [" + level.shortCode() + "] " + body, IDENTITY);
    }
}
