/**
 * Time-window engine.
 *
 * <p>
 * Two interchangeable {@link com.loglens.core.window.TimeWindow} strategies:
 * </p>
 * <ul>
 * <li>{@link com.loglens.core.window.SlidingWindow}: anchored at the latest
 * admission, emits on every admission</li>
 * <li>{@link com.loglens.core.window.TumblingWindow}: epoch-aligned,
 * non-overlapping, emits when a later value closes the window</li>
 * </ul>
 *
 * <p>
 * Both expect non-decreasing timestamps and drop values that arrive before
 * their lower bound.
 * </p>
 *
 * @since 1.0.0
 */
package com.loglens.core.window;
