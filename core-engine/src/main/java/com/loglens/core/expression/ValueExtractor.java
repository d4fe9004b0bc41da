package com.loglens.core.expression;

import com.loglens.core.model.LogEvent;

import java.io.Serializable;

/**
 * Pulls the numeric value a metric aggregates out of an event.
 */
@FunctionalInterface
public interface ValueExtractor extends Serializable {

    /**
     * @param event source event
     * @return the numeric value
     * @throws ExpressionEvaluationException if the event carries no usable number
     */
    double valueOf(LogEvent event);
}
