package io.fanlog;

import io.fanlog.destination.Destination;
import io.fanlog.format.DefaultMessageFormatter;
import io.fanlog.format.MessageFormatter;
import io.fanlog.format.TimePatternBuilder;
import io.fanlog.history.HistoryBuffer;
import io.fanlog.spi.MetricsExporter;
import io.fanlog.util.Arguments;
import io.fanlog.util.Attempts;
import io.fanlog.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The dispatcher: owns a set of {@link Destination}s keyed by identifier, filters each log
 * call against them and fans the entry out.
 *
 * <p>Each leveled call formats its payload once, selects the destinations that are enabled
 * and whose minimum level the entry reaches, writes to them, then appends the line to the
 * history buffer if history is enabled. A failing destination never affects its siblings or
 * the caller.
 *
 * <p>In concurrent mode (the default) one task per qualifying destination runs on the
 * registry's daemon pool and the caller blocks until all of them finish, or until the
 * {@linkplain Builder#dispatchTimeoutMs(long) dispatch timeout} elapses. In sequential mode
 * destinations are written on the calling thread in insertion order.
 *
 * <p>A registry is caller-owned; close it to release the fan-out threads. After
 * {@link #close()} log calls still work but fan out on the calling thread.
 *
 * <pre>{@code
 * try (LogRegistry log = LogRegistry.builder()
 *         .destination(FileDestination.builder("File").maxLines(10_000).build())
 *         .destination(new TraceDestination("Trace"))
 *         .build()) {
 *     log.enableHistory(500);
 *     log.info("started");
 *     log.error(new IllegalStateException("boom", cause));
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class LogRegistry implements Log, AutoCloseable {
    private static final Logger logger = Logger.getLogger(LogRegistry.class.getName());

    public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss.SSS";
    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    private final Object destinationsLock = new Object();
    private volatile Map<String, Destination> destinations = Collections.emptyMap();

    private final Object historyLock = new Object();
    private volatile HistoryBuffer history;
    private volatile boolean historyEnabled;

    private volatile boolean globalEnabled = true;
    private volatile boolean concurrentDispatch;
    private volatile long dispatchTimeoutMs;
    private volatile String timePattern;
    private volatile DateTimeFormatter timeFormatter;

    private final MessageFormatter formatter;
    private final Clock clock;
    private final ProcessIdentity identity;
    private final MetricsExporter metrics;
    private final ExecutorService fanOutPool;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a registry with defaults: no destinations, concurrent dispatch, history off,
     * time format {@value #DEFAULT_TIME_FORMAT}.
     */
    public LogRegistry() {
        this(new Builder());
    }

    private LogRegistry(Builder builder) {
        this.formatter = Objects.requireNonNull(builder.formatter, "formatter");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.identity = builder.identity != null ? builder.identity : ProcessIdentity.current();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.concurrentDispatch = builder.concurrentDispatch;
        this.dispatchTimeoutMs = Arguments.requireNonNegative(builder.dispatchTimeoutMs, "dispatchTimeoutMs");
        setTimeFormat(builder.timeFormat);
        this.fanOutPool = Executors.newCachedThreadPool(new DaemonThreadFactory("fanlog-dispatch-"));
        for (Destination destination : builder.destinations) {
            addOrReplace(destination);
        }
        if (builder.historyCapacity > 0) {
            enableHistory(builder.historyCapacity);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Leveled log calls ───────────────────────────────────────────

    @Override
    public void debug(Object message) {
        log(Severity.DEBUG, message);
    }

    @Override
    public void info(Object message) {
        log(Severity.INFO, message);
    }

    @Override
    public void warn(Object message) {
        log(Severity.WARN, message);
    }

    @Override
    public void error(Object message) {
        log(Severity.ERROR, message);
    }

    @Override
    public void critical(Object message) {
        log(Severity.CRITICAL, message);
    }

    /**
     * Dispatches one entry. Returns immediately, without formatting, when the registry is
     * globally disabled. Never throws because of a destination.
     *
     * @param level   severity of the entry
     * @param message payload: a plain value, a {@link Throwable}, a
     *                {@link io.fanlog.format.StructuredCommand}, or null
     */
    @Override
    public void log(Severity level, Object message) {
        if (!globalEnabled) {
            return;
        }
        Objects.requireNonNull(level, "level");

        Instant now = clock.instant();
        String body = formatter.formatBody(message);
        String line = formatter.formatLine(now, level, body, timeFormatter);
        LogEntry entry = new LogEntry(now, level, message, body, line, identity);
        metrics.incrementEntries(level);

        List<Destination> targets = select(level);
        if (!targets.isEmpty()) {
            metrics.recordFanOut(targets.size());
            fanOut(targets, entry);
        }

        if (historyEnabled) {
            HistoryBuffer buffer = history;
            if (buffer != null) {
                buffer.append(line);
                metrics.recordHistorySize(buffer.size());
            }
        }
    }

    private List<Destination> select(Severity level) {
        List<Destination> selected = new ArrayList<>();
        for (Destination destination : destinations.values()) {
            if (destination.accepts(level)) {
                selected.add(destination);
            }
        }
        return selected;
    }

    private void fanOut(List<Destination> targets, LogEntry entry) {
        long timeoutMs = dispatchTimeoutMs;
        boolean inline = targets.size() == 1 && timeoutMs == 0;
        if (!concurrentDispatch || inline || closed.get()) {
            for (Destination destination : targets) {
                recordOutcome(deliver(destination, entry));
            }
            return;
        }

        List<Callable<Attempts.Outcome>> tasks = new ArrayList<>(targets.size());
        for (Destination destination : targets) {
            tasks.add(() -> deliver(destination, entry));
        }
        List<Future<Attempts.Outcome>> futures;
        try {
            futures = timeoutMs > 0
                    ? fanOutPool.invokeAll(tasks, timeoutMs, TimeUnit.MILLISECONDS)
                    : fanOutPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (RejectedExecutionException e) {
            // closed concurrently
            for (Destination destination : targets) {
                recordOutcome(deliver(destination, entry));
            }
            return;
        }

        for (int i = 0; i < futures.size(); i++) {
            awaitWrite(targets.get(i), futures.get(i));
        }
    }

    private void awaitWrite(Destination destination, Future<Attempts.Outcome> future) {
        try {
            recordOutcome(future.get());
        } catch (CancellationException e) {
            metrics.incrementWritesTimedOut();
            logger.log(Level.WARNING, "Write to destination '" + destination.identifier()
                    + "' abandoned after " + dispatchTimeoutMs + " ms");
        } catch (ExecutionException e) {
            metrics.incrementWritesDiscarded();
            logger.log(Level.FINE, "Write to destination '" + destination.identifier() + "' failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Attempts.Outcome deliver(Destination destination, LogEntry entry) {
        return Attempts.attemptReported(destination.identifier(), () -> destination.deliver(entry));
    }

    // a cancelled write never reaches here, so it is counted only as timed out
    private void recordOutcome(Attempts.Outcome outcome) {
        if (outcome == Attempts.Outcome.WRITTEN) {
            metrics.incrementWritesCompleted();
        } else {
            metrics.incrementWritesDiscarded();
        }
    }

    // ── Destinations ────────────────────────────────────────────────

    /**
     * Adds a destination. A destination already registered under the same identifier is
     * replaced, keeping its position in the dispatch order.
     *
     * @param destination the destination to add
     * @return this registry for chaining
     * @throws ConfigurationException if {@code destination} is null
     */
    public LogRegistry addOrReplace(Destination destination) {
        Arguments.requireNonNull(destination, "destination");
        Arguments.requireNonEmpty(destination.identifier(), "identifier");
        mutateDestinations(map -> map.put(destination.identifier(), destination));
        return this;
    }

    /**
     * Removes a destination.
     *
     * @param identifier identifier of the destination
     * @return {@code true} if a destination was found and removed
     * @throws ConfigurationException if {@code identifier} is null or empty
     */
    public boolean remove(String identifier) {
        Arguments.requireNonEmpty(identifier, "identifier");
        synchronized (destinationsLock) {
            if (!destinations.containsKey(identifier)) {
                return false;
            }
            mutateDestinations(map -> map.remove(identifier));
            return true;
        }
    }

    public void removeAll() {
        synchronized (destinationsLock) {
            destinations = Collections.emptyMap();
        }
    }

    /**
     * Enables a destination. Does nothing if no destination has this identifier; use
     * {@link #find(String)} to detect a missing one.
     *
     * @param identifier identifier of the destination
     */
    public void enable(String identifier) {
        withDestination(identifier, d -> d.setEnabled(true));
    }

    /**
     * Disables a destination. Does nothing if no destination has this identifier.
     *
     * @param identifier identifier of the destination
     */
    public void disable(String identifier) {
        withDestination(identifier, d -> d.setEnabled(false));
    }

    /**
     * Changes a destination's minimum level. Does nothing if no destination has this
     * identifier.
     *
     * @param identifier identifier of the destination
     * @param level      the new minimum level
     */
    public void setMinimumLevel(String identifier, Severity level) {
        Arguments.requireNonNull(level, "level");
        withDestination(identifier, d -> d.setMinimumLevel(level));
    }

    public Optional<Destination> find(String identifier) {
        Arguments.requireNonEmpty(identifier, "identifier");
        return Optional.ofNullable(destinations.get(identifier));
    }

    /**
     * @return identifiers in dispatch order
     */
    public Set<String> identifiers() {
        return destinations.keySet();
    }

    private void withDestination(String identifier, Consumer<Destination> action) {
        Arguments.requireNonEmpty(identifier, "identifier");
        Destination destination = destinations.get(identifier);
        if (destination != null) {
            action.accept(destination);
        }
    }

    private void mutateDestinations(Consumer<Map<String, Destination>> mutation) {
        synchronized (destinationsLock) {
            Map<String, Destination> copy = new LinkedHashMap<>(destinations);
            mutation.accept(copy);
            destinations = Collections.unmodifiableMap(copy);
        }
    }

    // ── Settings ────────────────────────────────────────────────────

    public boolean isGlobalEnabled() {
        return globalEnabled;
    }

    /**
     * Turns all logging on or off. While off, log calls return before touching the payload.
     *
     * @param enabled the new state
     */
    public void setGlobalEnabled(boolean enabled) {
        this.globalEnabled = enabled;
    }

    public String timeFormat() {
        return timePattern;
    }

    /**
     * Sets the {@link DateTimeFormatter} pattern of the line timestamp.
     *
     * <p>Default is {@value #DEFAULT_TIME_FORMAT}.
     *
     * @param pattern the pattern
     * @return this registry for chaining
     * @throws ConfigurationException if the pattern is empty or cannot format a timestamp
     */
    public LogRegistry setTimeFormat(String pattern) {
        Arguments.requireNonEmpty(pattern, "pattern");
        DateTimeFormatter candidate;
        try {
            candidate = DateTimeFormatter.ofPattern(pattern).withZone(clock.getZone());
            candidate.format(clock.instant());
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ConfigurationException("Invalid time format: " + pattern, e);
        }
        this.timeFormatter = candidate;
        this.timePattern = pattern;
        return this;
    }

    public LogRegistry setTimeFormat(TimePatternBuilder builder) {
        Arguments.requireNonNull(builder, "builder");
        return setTimeFormat(builder.toPattern());
    }

    public boolean isConcurrentDispatch() {
        return concurrentDispatch;
    }

    public LogRegistry setConcurrentDispatch(boolean concurrent) {
        this.concurrentDispatch = concurrent;
        return this;
    }

    public long dispatchTimeoutMs() {
        return dispatchTimeoutMs;
    }

    /**
     * Bounds how long a concurrent fan-out waits for its writes. Unfinished writes are
     * cancelled and abandoned. {@code 0} waits indefinitely.
     *
     * @param timeoutMs timeout in milliseconds, at least 0
     * @return this registry for chaining
     */
    public LogRegistry setDispatchTimeoutMs(long timeoutMs) {
        this.dispatchTimeoutMs = Arguments.requireNonNegative(timeoutMs, "dispatchTimeoutMs");
        return this;
    }

    // ── History ─────────────────────────────────────────────────────

    public LogRegistry enableHistory() {
        return enableHistory(DEFAULT_HISTORY_CAPACITY);
    }

    /**
     * Starts recording formatted lines. If history was only paused, the existing buffer and
     * its capacity are kept; otherwise a new buffer of {@code capacity} lines is created.
     *
     * @param capacity maximum number of lines kept, at least 1
     * @return this registry for chaining
     * @throws ConfigurationException if {@code capacity < 1}
     */
    public LogRegistry enableHistory(int capacity) {
        if (capacity < 1) {
            throw new ConfigurationException("history capacity must be >= 1");
        }
        synchronized (historyLock) {
            if (history == null) {
                history = new HistoryBuffer(capacity);
            }
            historyEnabled = true;
        }
        return this;
    }

    /**
     * Stops recording and discards the buffer.
     */
    public void disableHistory() {
        synchronized (historyLock) {
            historyEnabled = false;
            history = null;
        }
    }

    /**
     * Stops recording and keeps the buffer.
     */
    public void pauseHistory() {
        synchronized (historyLock) {
            historyEnabled = false;
        }
    }

    public boolean isHistoryEnabled() {
        return historyEnabled;
    }

    public void clearHistory() {
        HistoryBuffer buffer = history;
        if (buffer != null) {
            buffer.clear();
        }
    }

    /**
     * Returns the recorded lines, oldest first, as of this call.
     *
     * @return an immutable copy; empty when history is disabled
     */
    public List<String> getHistorySnapshot() {
        HistoryBuffer buffer = history;
        return buffer != null ? buffer.snapshot() : List.of();
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * Shuts down the fan-out pool, waiting up to five seconds for running writes.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        fanOutPool.shutdown();
        try {
            if (!fanOutPool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.log(Level.WARNING, "Fan-out pool did not terminate; forcing shutdown");
                fanOutPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            fanOutPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link LogRegistry}. */
    public static final class Builder {
        private MessageFormatter formatter = new DefaultMessageFormatter();
        private Clock clock = Clock.systemDefaultZone();
        private ProcessIdentity identity;
        private MetricsExporter metrics;
        private String timeFormat = DEFAULT_TIME_FORMAT;
        private boolean concurrentDispatch = true;
        private long dispatchTimeoutMs;
        private int historyCapacity;
        private final List<Destination> destinations = new ArrayList<>();

        private Builder() {
        }

        /**
         * Sets the payload formatter.
         *
         * <p>Optional. Defaults to {@link DefaultMessageFormatter}.
         *
         * @param formatter the formatter
         * @return this builder
         */
        public Builder formatter(MessageFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        /**
         * Sets the clock that stamps entries; its zone renders the timestamps.
         *
         * <p>Optional. Defaults to the system clock in the default zone.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Overrides the process identity attached to entries.
         *
         * <p>Optional. Defaults to {@link ProcessIdentity#current()}.
         *
         * @param identity the identity
         * @return this builder
         */
        public Builder identity(ProcessIdentity identity) {
            this.identity = identity;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder timeFormat(String pattern) {
            this.timeFormat = pattern;
            return this;
        }

        public Builder timeFormat(TimePatternBuilder pattern) {
            this.timeFormat = pattern.toPattern();
            return this;
        }

        public Builder concurrentDispatch(boolean concurrentDispatch) {
            this.concurrentDispatch = concurrentDispatch;
            return this;
        }

        /**
         * Sets the concurrent fan-out timeout.
         *
         * <p>Optional. Defaults to {@code 0}, which waits for every write.
         *
         * @param dispatchTimeoutMs timeout in milliseconds
         * @return this builder
         */
        public Builder dispatchTimeoutMs(long dispatchTimeoutMs) {
            this.dispatchTimeoutMs = dispatchTimeoutMs;
            return this;
        }

        /**
         * Enables history with the given capacity.
         *
         * @param capacity maximum number of lines kept
         * @return this builder
         */
        public Builder history(int capacity) {
            if (capacity < 1) {
                throw new ConfigurationException("history capacity must be >= 1");
            }
            this.historyCapacity = capacity;
            return this;
        }

        public Builder destination(Destination destination) {
            this.destinations.add(destination);
            return this;
        }

        /**
         * @return a new registry
         * @throws ConfigurationException if the time format, timeout or a destination is invalid
         */
        public LogRegistry build() {
            return new LogRegistry(this);
        }
    }
}
