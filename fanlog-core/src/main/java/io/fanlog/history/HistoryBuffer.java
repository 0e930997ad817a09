package io.fanlog.history;

import io.fanlog.ConfigurationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of formatted log lines. When full, each append evicts the oldest line.
 *
 * <p>Capacity is fixed for the lifetime of the buffer. All operations hold the buffer's
 * monitor, so concurrent appends from in-flight dispatches are safe, and
 * {@link #snapshot()} never observes a partial mutation.
 */
public final class HistoryBuffer {
    private final int capacity;
    private final Deque<String> lines;

    /**
     * @param capacity maximum number of retained lines, at least 1
     * @throws ConfigurationException if {@code capacity < 1}
     */
    public HistoryBuffer(int capacity) {
        if (capacity < 1) {
            throw new ConfigurationException("history capacity must be >= 1");
        }
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void append(String line) {
        if (lines.size() >= capacity) {
            lines.removeFirst();
        }
        lines.addLast(line);
    }

    public synchronized void clear() {
        lines.clear();
    }

    /**
     * Copies the current contents, oldest first.
     *
     * @return an immutable list unaffected by later appends
     */
    public synchronized List<String> snapshot() {
        return List.copyOf(lines);
    }

    public synchronized int size() {
        return lines.size();
    }

    public int capacity() {
        return capacity;
    }
}
