package com.loglens.core.expression;

/**
 * Turns declarative expressions from configuration into the three event
 * functions a metric needs.
 *
 * <p>
 * The metric engine only depends on {@link EventPredicate},
 * {@link GroupKeyExtractor} and {@link ValueExtractor}; how expressions are
 * parsed and executed is up to the implementation, which can be swapped via
 * {@link com.loglens.core.config.MetricDefinitionFactory}.
 * </p>
 *
 * @see DefaultExpressionEvaluator
 */
public interface ExpressionEvaluator {

    /**
     * @param expression filter expression, e.g. {@code event.level in ('ERROR', 'CRITICAL')}
     * @return compiled predicate
     * @throws InvalidExpressionException if the expression is malformed
     */
    EventPredicate compilePredicate(String expression) throws InvalidExpressionException;

    /**
     * @param expression group key expression, e.g. {@code event.source}
     * @return compiled key extractor
     * @throws InvalidExpressionException if the expression is malformed
     */
    GroupKeyExtractor compileGroupKey(String expression) throws InvalidExpressionException;

    /**
     * @param expression numeric expression, e.g. {@code event.metadata.response_time}
     * @return compiled value extractor
     * @throws InvalidExpressionException if the expression is malformed
     */
    ValueExtractor compileValue(String expression) throws InvalidExpressionException;
}
