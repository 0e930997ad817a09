package io.fanlog.destination;

import io.fanlog.LogEntry;
import io.fanlog.Severity;
import io.fanlog.util.Attempts;

/**
 * An output channel with its own severity filter and enabled flag.
 *
 * <p>A {@link io.fanlog.LogRegistry} holds at most one destination per
 * {@linkplain #identifier() identifier} and calls {@link #write(LogEntry)} for every entry
 * that passes {@link #accepts(Severity)}. Nothing else should call {@code write}.
 *
 * <p>Implementations must not let failures escape {@code write}: I/O, connectivity and
 * transport errors are absorbed at this boundary. The registry still guards each call, so a
 * misbehaving implementation cannot affect its siblings or the logging caller.
 *
 * @see AbstractDestination
 */
public interface Destination {

    /**
     * @return the unique key of this destination within a registry
     */
    String identifier();

    /**
     * @return entries below this level are not written
     */
    Severity minimumLevel();

    void setMinimumLevel(Severity minimumLevel);

    boolean isEnabled();

    void setEnabled(boolean enabled);

    /**
     * Writes one entry. Must not throw.
     *
     * @param entry the formatted entry
     */
    void write(LogEntry entry);

    /**
     * Writes one entry and reports whether it reached the channel. Must not throw.
     *
     * <p>The default calls {@link #write(LogEntry)} and reports
     * {@link Attempts.Outcome#WRITTEN}. Implementations that absorb their own failures
     * override it so the registry can count those writes as discarded.
     *
     * @param entry the formatted entry
     * @return the outcome of the write
     */
    default Attempts.Outcome deliver(LogEntry entry) {
        write(entry);
        return Attempts.Outcome.WRITTEN;
    }

    /**
     * Returns whether an entry of the given level should be written here.
     *
     * @param level severity of the entry
     * @return {@code true} if enabled and {@code level} is at or above the minimum level
     */
    default boolean accepts(Severity level) {
        return isEnabled() && level.isAtLeast(minimumLevel());
    }
}
