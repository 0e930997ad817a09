package io.fanlog.spi;

import io.fanlog.Severity;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code fanlog-micrometer} provides a
 * Micrometer implementation.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Counts an entry that passed the global switch and was dispatched.
     *
     * @param level severity of the entry
     */
    void incrementEntries(Severity level);

    /**
     * Counts a destination write that returned normally.
     */
    void incrementWritesCompleted();

    /**
     * Counts a destination write that threw past the destination boundary and was discarded
     * by the registry.
     */
    void incrementWritesDiscarded();

    /**
     * Counts a destination write abandoned because the dispatch timeout elapsed.
     */
    default void incrementWritesTimedOut() {
    }

    /**
     * Records how many destinations qualified for one entry.
     *
     * @param destinationCount number of qualifying destinations, at least 1
     */
    default void recordFanOut(int destinationCount) {
    }

    /**
     * Records the number of lines held by the history buffer.
     *
     * @param size current history size
     */
    default void recordHistorySize(int size) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEntries(Severity level) {
        }

        @Override
        public void incrementWritesCompleted() {
        }

        @Override
        public void incrementWritesDiscarded() {
        }
    }
}
