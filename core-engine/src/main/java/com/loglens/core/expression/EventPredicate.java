package com.loglens.core.expression;

import com.loglens.core.model.LogEvent;

import java.io.Serializable;

/**
 * Boolean test over an event, used as a metric filter.
 */
@FunctionalInterface
public interface EventPredicate extends Serializable {

    /** Predicate admitting every event. */
    EventPredicate ALL = event -> true;

    /**
     * @param event event under test
     * @return {@code true} if the event belongs to the metric
     * @throws ExpressionEvaluationException if the predicate cannot be evaluated for this event
     */
    boolean test(LogEvent event);
}
