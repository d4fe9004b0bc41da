package com.loglens.core.metric;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingEvaluationErrorHandler implements EvaluationErrorHandler {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LoggingEvaluationErrorHandler.class);

    @Override
    public void onError(EvaluationException error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        LOG.warn("Metric [{}] skipped event {}: {}", error.getMetricName(), error.getEvent(), cause.getMessage());
    }
}
