package com.loglens.core.window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed, non-overlapping, boundary-aligned window.
 *
 * <h3>Boundaries</h3>
 * <p>
 * The first admission floors its timestamp to a multiple of the duration
 * since the epoch, so a five-minute window starts at :00, :05, :10 and so on.
 * Windows are half-open: {@code [start, end)}.
 * </p>
 *
 * <h3>Emission</h3>
 * <p>
 * Values are buffered. A value at or beyond {@code end} finalises the buffered
 * window (which is emitted), advances the bounds by whole durations until they
 * contain the value, and then starts the new buffer with it. Windows skipped
 * over by a gap held no values and are not emitted. There is no timer: a
 * caller needing the final partial window must call {@link #flush()}.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * A value earlier than the current {@code start} is dropped and counted in
 * {@link #droppedCount()}. A value inside the current window is accepted in
 * any order.
 * </p>
 *
 * @param <T> type of value held by the window
 * @since 1.0.0
 */
public class TumblingWindow<T> implements TimeWindow<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TumblingWindow.class);

    private final Duration duration;
    private final long durationMillis;

    private final List<T> buffer = new ArrayList<>();

    private Instant start;
    private Instant end;

    private long dropped;

    /**
     * @param duration window length; a positive whole number of milliseconds
     * @throws IllegalArgumentException if {@code duration} is shorter than one
     *                                  millisecond or has a sub-millisecond part
     */
    public TumblingWindow(Duration duration) {
        requireWholeMillis(duration);
        this.duration = duration;
        this.durationMillis = duration.toMillis();
    }

    /**
     * Buckets are aligned on epoch milliseconds, so the length must be a
     * positive whole number of them.
     *
     * @throws IllegalArgumentException otherwise
     */
    static void requireWholeMillis(Duration duration) {
        Objects.requireNonNull(duration, "Window duration must not be null");
        if (duration.toMillis() < 1) {
            throw new IllegalArgumentException(
                    "Tumbling window duration must be at least 1ms, got: " + duration);
        }
        if (duration.getNano() % 1_000_000 != 0) {
            throw new IllegalArgumentException(
                    "Tumbling window duration must be a whole number of milliseconds, got: " + duration);
        }
    }

    @Override
    public Optional<WindowSnapshot<T>> add(T value, Instant timestamp) {
        Objects.requireNonNull(timestamp, "Timestamp must not be null");

        if (start == null) {
            start = align(timestamp);
            end = start.plusMillis(durationMillis);
        }

        if (timestamp.isBefore(start)) {
            dropped++;
            LOG.debug("Dropping late entry at {} (current window starts {})", timestamp, start);
            return Optional.empty();
        }

        Optional<WindowSnapshot<T>> closed = Optional.empty();
        if (!timestamp.isBefore(end)) {
            if (!buffer.isEmpty()) {
                closed = Optional.of(new WindowSnapshot<>(start, end, buffer));
                buffer.clear();
            }
            long skipped = Duration.between(end, timestamp).toMillis() / durationMillis;
            start = end.plusMillis(skipped * durationMillis);
            end = start.plusMillis(durationMillis);
            LOG.debug("Advanced tumbling window to [{}, {})", start, end);
        }

        buffer.add(value);
        return closed;
    }

    /**
     * Emit the partial current window and empty the buffer. Bounds are kept,
     * so later values in the same window start a fresh buffer.
     */
    @Override
    public Optional<WindowSnapshot<T>> flush() {
        if (buffer.isEmpty()) {
            return Optional.empty();
        }
        WindowSnapshot<T> partial = new WindowSnapshot<>(start, end, buffer);
        buffer.clear();
        return Optional.of(partial);
    }

    @Override
    public List<T> values() {
        return Collections.unmodifiableList(new ArrayList<>(buffer));
    }

    @Override
    public Instant start() {
        return start;
    }

    @Override
    public Instant end() {
        return end;
    }

    @Override
    public int size() {
        return buffer.size();
    }

    @Override
    public long droppedCount() {
        return dropped;
    }

    @Override
    public void clear() {
        buffer.clear();
        start = null;
        end = null;
        dropped = 0;
    }

    public Duration getDuration() {
        return duration;
    }

    private Instant align(Instant timestamp) {
        long millis = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, durationMillis) * durationMillis);
    }
}
