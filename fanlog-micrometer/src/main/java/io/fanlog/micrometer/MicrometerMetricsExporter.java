package io.fanlog.micrometer;

import io.fanlog.Severity;
import io.fanlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a distribution summary with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code fanlog.entries} - entries dispatched, tagged {@code level=debug|info|...}</li>
 *   <li>{@code fanlog.writes.completed} - destination writes that returned normally</li>
 *   <li>{@code fanlog.writes.discarded} - destination writes discarded by the registry</li>
 *   <li>{@code fanlog.writes.timed_out} - destination writes abandoned by the dispatch timeout</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code fanlog.history.size} - lines held by the history buffer</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code fanlog.dispatch.fanout} - qualifying destinations per entry</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Map<Severity, Counter> entries = new EnumMap<>(Severity.class);
    private final Counter writesCompleted;
    private final Counter writesDiscarded;
    private final Counter writesTimedOut;
    private final Gauge historySizeGauge;
    private final DistributionSummary fanOut;

    private final AtomicInteger historySize = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "fanlog"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "fanlog");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.fanlog"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        for (Severity level : Severity.values()) {
            entries.put(level, Counter.builder(namePrefix + ".entries")
                    .description("Log entries dispatched")
                    .tag("level", level.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.writesCompleted = Counter.builder(namePrefix + ".writes.completed")
                .description("Destination writes that returned normally")
                .register(registry);
        this.writesDiscarded = Counter.builder(namePrefix + ".writes.discarded")
                .description("Destination writes that failed and were discarded")
                .register(registry);
        this.writesTimedOut = Counter.builder(namePrefix + ".writes.timed_out")
                .description("Destination writes abandoned after the dispatch timeout")
                .register(registry);

        this.historySizeGauge = Gauge.builder(namePrefix + ".history.size", historySize, AtomicInteger::get)
                .register(registry);

        this.fanOut = DistributionSummary.builder(namePrefix + ".dispatch.fanout")
                .description("Qualifying destinations per entry")
                .register(registry);
    }

    @Override
    public void incrementEntries(Severity level) {
        if (closed) return;
        entries.get(level).increment();
    }

    @Override
    public void incrementWritesCompleted() {
        if (closed) return;
        writesCompleted.increment();
    }

    @Override
    public void incrementWritesDiscarded() {
        if (closed) return;
        writesDiscarded.increment();
    }

    @Override
    public void incrementWritesTimedOut() {
        if (closed) return;
        writesTimedOut.increment();
    }

    @Override
    public void recordFanOut(int destinationCount) {
        if (closed) return;
        fanOut.record(destinationCount);
    }

    @Override
    public void recordHistorySize(int size) {
        if (closed) return;
        historySize.set(size);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed (e.g. when the
     * {@link io.fanlog.LogRegistry} is closed) to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(entries.values());
        meters.addAll(List.of(writesCompleted, writesDiscarded, writesTimedOut, historySizeGauge, fanOut));
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
