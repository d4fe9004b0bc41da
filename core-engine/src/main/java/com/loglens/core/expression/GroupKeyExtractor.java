package com.loglens.core.expression;

import com.loglens.core.model.LogEvent;

import java.io.Serializable;

/**
 * Derives the group an event belongs to within a grouped metric.
 */
@FunctionalInterface
public interface GroupKeyExtractor extends Serializable {

    /**
     * @param event event to classify
     * @return group key; {@code null} is reported as the group {@code "null"}
     * @throws ExpressionEvaluationException if the key cannot be evaluated for this event
     */
    String keyOf(LogEvent event);
}
