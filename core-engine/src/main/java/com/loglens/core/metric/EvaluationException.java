package com.loglens.core.metric;

import com.loglens.core.model.LogEvent;

/**
 * A metric's filter, group key or value extractor failed on one event.
 *
 * <p>
 * Recovered per event and per metric: the processor hands it to its
 * {@link EvaluationErrorHandler} and carries on with the other metrics.
 * </p>
 */
public class EvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final transient LogEvent event;

    public EvaluationException(String metricName, LogEvent event, Throwable cause) {
        super("Failed to evaluate metric '" + metricName + "' for event " + event
                + ": " + cause.getMessage(), cause);
        this.metricName = metricName;
        this.event = event;
    }

    public String getMetricName() {
        return metricName;
    }

    public LogEvent getEvent() {
        return event;
    }
}
