package com.loglens.core.expression;

import com.loglens.core.expression.grammar.ExpressionNode;
import com.loglens.core.expression.grammar.ExpressionParser;
import com.loglens.core.expression.grammar.ValueSemantics;
import com.loglens.core.model.LogEvent;

/**
 * {@link ExpressionEvaluator} backed by the restricted grammar in
 * {@code com.loglens.core.expression.grammar}.
 *
 * <p>
 * Expressions are parsed once at configuration time; the compiled functions
 * are serializable so they can live in Flink operator state.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultExpressionEvaluator implements ExpressionEvaluator {

    @Override
    public EventPredicate compilePredicate(String expression) throws InvalidExpressionException {
        return new CompiledPredicate(expression, ExpressionParser.parse(expression));
    }

    @Override
    public GroupKeyExtractor compileGroupKey(String expression) throws InvalidExpressionException {
        return new CompiledGroupKey(expression, ExpressionParser.parse(expression));
    }

    @Override
    public ValueExtractor compileValue(String expression) throws InvalidExpressionException {
        return new CompiledValue(expression, ExpressionParser.parse(expression));
    }

    // -------------------------------------------------------------------------
    // Compiled forms
    // -------------------------------------------------------------------------

    private static final class CompiledPredicate implements EventPredicate {

        private static final long serialVersionUID = 1L;

        private final String source;
        private final ExpressionNode root;

        CompiledPredicate(String source, ExpressionNode root) {
            this.source = source;
            this.root = root;
        }

        @Override
        public boolean test(LogEvent event) {
            return ValueSemantics.isTruthy(root.evaluate(event));
        }

        @Override
        public String toString() {
            return source;
        }
    }

    private static final class CompiledGroupKey implements GroupKeyExtractor {

        private static final long serialVersionUID = 1L;

        private final String source;
        private final ExpressionNode root;

        CompiledGroupKey(String source, ExpressionNode root) {
            this.source = source;
            this.root = root;
        }

        @Override
        public String keyOf(LogEvent event) {
            return String.valueOf(root.evaluate(event));
        }

        @Override
        public String toString() {
            return source;
        }
    }

    private static final class CompiledValue implements ValueExtractor {

        private static final long serialVersionUID = 1L;

        private final String source;
        private final ExpressionNode root;

        CompiledValue(String source, ExpressionNode root) {
            this.source = source;
            this.root = root;
        }

        @Override
        public double valueOf(LogEvent event) {
            return requireFinite(toDouble(root.evaluate(event)));
        }

        private double toDouble(Object result) {
            if (result instanceof Number n) {
                return n.doubleValue();
            }
            if (result instanceof String s) {
                try {
                    return Double.parseDouble(s.trim());
                } catch (NumberFormatException e) {
                    throw new ExpressionEvaluationException(
                            "Value '" + s + "' of '" + source + "' is not numeric", e);
                }
            }
            throw new ExpressionEvaluationException("Expression '" + source
                    + "' produced " + (result == null ? "null" : result) + ", expected a number");
        }

        private double requireFinite(double value) {
            if (!Double.isFinite(value)) {
                throw new ExpressionEvaluationException(
                        "Expression '" + source + "' produced " + value + ", expected a finite number");
            }
            return value;
        }

        @Override
        public String toString() {
            return source;
        }
    }
}
