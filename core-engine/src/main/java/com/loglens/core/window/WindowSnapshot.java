package com.loglens.core.window;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a window's bounds and contents at the moment it emitted.
 *
 * @param <T> type of value held by the window
 */
public final class WindowSnapshot<T> {

    private final Instant start;
    private final Instant end;
    private final List<T> values;

    public WindowSnapshot(Instant start, Instant end, List<T> values) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public List<T> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "WindowSnapshot{[" + start + ", " + end + "], size=" + values.size() + '}';
    }
}
