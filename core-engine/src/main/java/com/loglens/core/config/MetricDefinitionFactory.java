package com.loglens.core.config;

import com.loglens.core.expression.DefaultExpressionEvaluator;
import com.loglens.core.expression.ExpressionEvaluator;
import com.loglens.core.expression.InvalidExpressionException;
import com.loglens.core.metric.MetricDefinition;
import com.loglens.core.metric.MetricProcessor;
import com.loglens.core.metric.MetricProcessorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns {@link MetricConfig} entries into {@link MetricDefinition}s by
 * compiling their expressions.
 *
 * <p>
 * Uses {@link DefaultExpressionEvaluator} unless another
 * {@link ExpressionEvaluator} is supplied.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricDefinitionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(MetricDefinitionFactory.class);

    private static final ExpressionEvaluator DEFAULT_EVALUATOR = new DefaultExpressionEvaluator();

    private MetricDefinitionFactory() {
        // utility class
    }

    public static MetricDefinition create(MetricConfig config) {
        return create(config, DEFAULT_EVALUATOR);
    }

    /**
     * @throws ConfigurationException if the config is invalid or an expression
     *         does not compile
     */
    public static MetricDefinition create(MetricConfig config, ExpressionEvaluator evaluator) {
        Objects.requireNonNull(config, "MetricConfig must not be null");
        Objects.requireNonNull(evaluator, "ExpressionEvaluator must not be null");
        String name = config.getName();

        MetricDefinition.Builder builder = MetricDefinition.builder()
                .name(name)
                .description(config.getDescription())
                .aggregation(config.getAggregation(), config.getPercentile())
                .window(config.getWindow(), config.getWindowType());

        try {
            if (isSet(config.getFilter())) {
                builder.filter(evaluator.compilePredicate(config.getFilter()));
            }
            if (isSet(config.getGroupBy())) {
                builder.groupBy(evaluator.compileGroupKey(config.getGroupBy()));
            }
            if (isSet(config.getValueExtractor())) {
                builder.valueExtractor(evaluator.compileValue(config.getValueExtractor()));
            }
        } catch (InvalidExpressionException e) {
            throw new ConfigurationException("Metric '" + name + "': " + e.getMessage(), e);
        }

        MetricDefinition definition = builder.build();
        LOG.debug("Created metric definition {}", definition);
        return definition;
    }

    /**
     * @return unmodifiable list, one definition per config, same order
     */
    public static List<MetricDefinition> createAll(List<MetricConfig> configs) {
        Objects.requireNonNull(configs, "Metric configs must not be null");
        LOG.info("Creating {} metric definition(s) from configuration", configs.size());
        return Collections.unmodifiableList(configs.stream()
                .map(MetricDefinitionFactory::create)
                .toList());
    }

    /**
     * Build a processor for every metric in {@code config}.
     */
    public static MetricProcessor createProcessor(LogLensConfig config) {
        Objects.requireNonNull(config, "LogLensConfig must not be null");
        MetricProcessorOptions options = MetricProcessorOptions.builder()
                .maxGroupsPerMetric(config.getMaxGroupsPerMetric())
                .build();
        return new MetricProcessor(createAll(config.getMetrics()), options);
    }

    private static boolean isSet(String expression) {
        return expression != null && !expression.isBlank();
    }
}
