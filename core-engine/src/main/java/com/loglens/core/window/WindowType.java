package com.loglens.core.window;

import java.time.Duration;
import java.util.Locale;

/**
 * Windowing strategy of a metric.
 */
public enum WindowType {

    /** Evicts expired entries on every admission and emits every time. */
    SLIDING {
        @Override
        public <T> TimeWindow<T> create(Duration duration) {
            return new SlidingWindow<>(duration);
        }
    },

    /** Emits once per aligned, non-overlapping interval. */
    TUMBLING {
        @Override
        public <T> TimeWindow<T> create(Duration duration) {
            return new TumblingWindow<>(duration);
        }
    };

    /**
     * Instantiate a fresh window of this type.
     *
     * @param duration window length
     * @param <T>      type of value held by the window
     * @return a new, empty window
     */
    public abstract <T> TimeWindow<T> create(Duration duration);

    /**
     * @param name type name, case-insensitive; {@code null} or blank means {@link #SLIDING}
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static WindowType fromName(String name) {
        if (name == null || name.isBlank()) {
            return SLIDING;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown window type: '" + name + "'. Supported: sliding, tumbling", e);
        }
    }
}
