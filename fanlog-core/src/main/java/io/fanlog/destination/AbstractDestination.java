package io.fanlog.destination;

import io.fanlog.LogEntry;
import io.fanlog.Severity;
import io.fanlog.util.Arguments;
import io.fanlog.util.Attempts;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base class for the built-in destinations.
 *
 * <p>Holds the identifier, minimum level and enabled flag, and turns the contract of
 * {@link Destination#write(LogEntry)} into a template: {@link #append(LogEntry)} may throw,
 * and every failure is discarded through {@link Attempts#attempt}. Writes to one instance are
 * serialized by a per-instance lock, so subclasses never see two concurrent appends.
 */
public abstract class AbstractDestination implements Destination {
    private final String identifier;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong discardedWrites = new AtomicLong();
    private volatile Severity minimumLevel;
    private volatile boolean enabled = true;

    /**
     * @param identifier   unique key, not null or empty
     * @param minimumLevel initial minimum level, not null
     * @throws io.fanlog.ConfigurationException if either argument is invalid
     */
    protected AbstractDestination(String identifier, Severity minimumLevel) {
        this.identifier = Arguments.requireNonEmpty(identifier, "identifier");
        this.minimumLevel = Arguments.requireNonNull(minimumLevel, "minimumLevel");
    }

    @Override
    public final String identifier() {
        return identifier;
    }

    @Override
    public Severity minimumLevel() {
        return minimumLevel;
    }

    @Override
    public void setMinimumLevel(Severity minimumLevel) {
        this.minimumLevel = Arguments.requireNonNull(minimumLevel, "minimumLevel");
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public final void write(LogEntry entry) {
        deliver(entry);
    }

    @Override
    public final Attempts.Outcome deliver(LogEntry entry) {
        writeLock.lock();
        try {
            Attempts.Outcome outcome = Attempts.attempt(identifier, () -> append(entry));
            if (outcome == Attempts.Outcome.DISCARDED) {
                discardedWrites.incrementAndGet();
            }
            return outcome;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Performs the actual write. Runs under the instance's write lock.
     *
     * @param entry the formatted entry
     * @throws Exception on any failure; the failure is discarded by {@link #write(LogEntry)}
     */
    protected abstract void append(LogEntry entry) throws Exception;

    /**
     * @return number of writes whose failure was absorbed by this destination
     */
    public long discardedWrites() {
        return discardedWrites.get();
    }

    @Override
    public String toString() {
        return identifier;
    }
}
