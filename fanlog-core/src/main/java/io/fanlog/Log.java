package io.fanlog;

/**
 * Leveled logging calls, for code that only writes entries and should not depend on how
 * they are dispatched.
 *
 * <p>Implementations never throw because of an output channel. A {@code message} may be a
 * plain value, a {@link Throwable}, a {@link io.fanlog.format.StructuredCommand} or null.
 *
 * @see LogRegistry
 */
public interface Log {

    /**
     * Records one entry at the given level.
     *
     * @param level   severity of the entry, not null
     * @param message payload
     */
    void log(Severity level, Object message);

    default void debug(Object message) {
        log(Severity.DEBUG, message);
    }

    default void info(Object message) {
        log(Severity.INFO, message);
    }

    default void warn(Object message) {
        log(Severity.WARN, message);
    }

    default void error(Object message) {
        log(Severity.ERROR, message);
    }

    default void critical(Object message) {
        log(Severity.CRITICAL, message);
    }
}
