package com.loglens.core.metric;

import java.io.Serializable;

/**
 * Receives per-event evaluation failures from {@link MetricProcessor}.
 */
@FunctionalInterface
public interface EvaluationErrorHandler extends Serializable {

    /** Logs the failure at WARN and continues. */
    EvaluationErrorHandler LOGGING = new LoggingEvaluationErrorHandler();

    void onError(EvaluationException error);
}
