package com.loglens.core.window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Continuously advancing window anchored at the most recent admission.
 *
 * <h3>Implementation</h3>
 * <p>
 * Maintains a deque of (value, timestamp) entries. Each admission appends to
 * the tail and then evicts from the head every entry strictly older than
 * {@code incoming - duration}. Every entry is evicted at most once, so the
 * cost per admission is amortised O(1) and memory is bounded by
 * {@code duration × arrival rate}.
 * </p>
 *
 * <p>
 * A snapshot is emitted on every admission, bounded by
 * {@code [incoming - duration, incoming]}.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * A value whose timestamp is earlier than the latest admitted timestamp is
 * dropped: the window is left untouched and {@link #droppedCount()} is
 * incremented.
 * </p>
 *
 * @param <T> type of value held by the window
 * @since 1.0.0
 */
public class SlidingWindow<T> implements TimeWindow<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SlidingWindow.class);

    private final Duration duration;

    private final Deque<Entry<T>> entries = new ArrayDeque<>();

    /** Most recently admitted timestamp; anchors the window's upper bound. */
    private Instant latest;

    private long dropped;

    /**
     * @param duration window length; must be positive
     * @throws IllegalArgumentException if {@code duration} is zero or negative
     */
    public SlidingWindow(Duration duration) {
        Objects.requireNonNull(duration, "Window duration must not be null");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Window duration must be positive, got: " + duration);
        }
        this.duration = duration;
    }

    @Override
    public Optional<WindowSnapshot<T>> add(T value, Instant timestamp) {
        Objects.requireNonNull(timestamp, "Timestamp must not be null");

        if (latest != null && timestamp.isBefore(latest)) {
            dropped++;
            LOG.debug("Dropping out-of-order entry at {} (latest admitted: {})", timestamp, latest);
            return Optional.empty();
        }

        latest = timestamp;
        entries.addLast(new Entry<>(value, timestamp));
        evictBefore(timestamp.minus(duration));

        return Optional.of(snapshot());
    }

    /**
     * Evict every entry that is out of scope at {@code now} without admitting
     * anything. Used to age windows that received no value at {@code now}.
     * The window's anchor is left unchanged.
     *
     * @param now current stream time; must not be {@code null}
     * @return number of entries evicted
     */
    public int expire(Instant now) {
        Objects.requireNonNull(now, "Timestamp must not be null");
        return evictBefore(now.minus(duration));
    }

    /**
     * Report the current contents without altering them.
     */
    @Override
    public Optional<WindowSnapshot<T>> flush() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(snapshot());
    }

    @Override
    public List<T> values() {
        List<T> values = new ArrayList<>(entries.size());
        for (Entry<T> entry : entries) {
            values.add(entry.value);
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @return timestamps of the entries in scope, oldest first
     */
    public List<Instant> timestamps() {
        List<Instant> timestamps = new ArrayList<>(entries.size());
        for (Entry<T> entry : entries) {
            timestamps.add(entry.timestamp);
        }
        return Collections.unmodifiableList(timestamps);
    }

    @Override
    public Instant start() {
        return latest != null ? latest.minus(duration) : null;
    }

    @Override
    public Instant end() {
        return latest;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public long droppedCount() {
        return dropped;
    }

    @Override
    public void clear() {
        entries.clear();
        latest = null;
        dropped = 0;
    }

    public Duration getDuration() {
        return duration;
    }

    private int evictBefore(Instant lowerBound) {
        int evicted = 0;
        while (!entries.isEmpty() && entries.peekFirst().timestamp.isBefore(lowerBound)) {
            entries.pollFirst();
            evicted++;
        }
        return evicted;
    }

    private WindowSnapshot<T> snapshot() {
        return new WindowSnapshot<>(start(), latest, values());
    }

    private static final class Entry<T> implements Serializable {

        private static final long serialVersionUID = 1L;

        private final T value;
        private final Instant timestamp;

        private Entry(T value, Instant timestamp) {
            this.value = value;
            this.timestamp = timestamp;
        }
    }
}
