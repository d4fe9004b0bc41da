package com.loglens.core.window;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Strategy deciding which values are in scope at any instant and when the
 * window's aggregate is due.
 *
 * <p>
 * Values must be added in non-decreasing timestamp order. Implementations
 * document how they treat a value that arrives earlier than their current
 * lower bound; both built-in strategies drop it and count it in
 * {@link #droppedCount()}.
 * </p>
 *
 * <p>
 * Instances are <strong>not</strong> thread-safe and are owned by exactly one
 * metric (or one group of a grouped metric).
 * </p>
 *
 * @param <T> type of value held by the window
 * @since 1.0.0
 */
public interface TimeWindow<T> extends Serializable {

    /**
     * Admit a value.
     *
     * @param value     value to admit
     * @param timestamp event time of the value; must not be {@code null}
     * @return the window contents to aggregate, if this admission produced or
     *         updated a result; empty otherwise
     */
    Optional<WindowSnapshot<T>> add(T value, Instant timestamp);

    /**
     * Force out the current contents, e.g. at end of stream.
     *
     * @return the current contents, or empty if there is nothing to report
     */
    Optional<WindowSnapshot<T>> flush();

    /**
     * @return unmodifiable copy of the values currently in scope
     */
    List<T> values();

    /**
     * @return lower bound of the current window, or {@code null} before the first admission
     */
    Instant start();

    /**
     * @return upper bound of the current window, or {@code null} before the first admission
     */
    Instant end();

    int size();

    /**
     * @return number of values rejected for arriving before the window's lower bound
     */
    long droppedCount();

    /**
     * Return the window to its freshly constructed state.
     */
    void clear();
}
