package com.loglens.core.expression.grammar;

import com.loglens.core.expression.ExpressionEvaluationException;
import com.loglens.core.model.LogEvent;

/**
 * Logical, comparison, membership or arithmetic operation on two operands.
 *
 * <p>
 * {@code and}/{@code or} short-circuit and always yield a {@link Boolean}.
 * Arithmetic yields a {@link Double}; {@code +} on two strings concatenates.
 * </p>
 */
public final class BinaryNode implements ExpressionNode {

    private static final long serialVersionUID = 1L;

    public enum Operator {
        AND("and"),
        OR("or"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        IN("in"),
        NOT_IN("not in"),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            return null;
        }
    }

    private final Operator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;

    public BinaryNode(Operator operator, ExpressionNode left, ExpressionNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(LogEvent event) {
        if (operator == Operator.AND) {
            return ValueSemantics.isTruthy(left.evaluate(event))
                    && ValueSemantics.isTruthy(right.evaluate(event));
        }
        if (operator == Operator.OR) {
            return ValueSemantics.isTruthy(left.evaluate(event))
                    || ValueSemantics.isTruthy(right.evaluate(event));
        }

        Object l = left.evaluate(event);
        Object r = right.evaluate(event);
        String symbol = operator.getSymbol();

        return switch (operator) {
            case EQUAL -> ValueSemantics.areEqual(l, r);
            case NOT_EQUAL -> !ValueSemantics.areEqual(l, r);
            case LESS -> ValueSemantics.compare(l, r, symbol) < 0;
            case LESS_OR_EQUAL -> ValueSemantics.compare(l, r, symbol) <= 0;
            case GREATER -> ValueSemantics.compare(l, r, symbol) > 0;
            case GREATER_OR_EQUAL -> ValueSemantics.compare(l, r, symbol) >= 0;
            case IN -> ValueSemantics.contains(r, l);
            case NOT_IN -> !ValueSemantics.contains(r, l);
            case ADD -> add(l, r);
            case SUBTRACT -> ValueSemantics.toNumber(l, symbol) - ValueSemantics.toNumber(r, symbol);
            case MULTIPLY -> ValueSemantics.toNumber(l, symbol) * ValueSemantics.toNumber(r, symbol);
            case DIVIDE -> ValueSemantics.toNumber(l, symbol) / nonZero(ValueSemantics.toNumber(r, symbol));
            case MODULO -> ValueSemantics.toNumber(l, symbol) % nonZero(ValueSemantics.toNumber(r, symbol));
            default -> throw new IllegalStateException("Unhandled operator: " + operator);
        };
    }

    private static Object add(Object l, Object r) {
        if (l instanceof String ls && r instanceof String rs) {
            return ls + rs;
        }
        return ValueSemantics.toNumber(l, "+") + ValueSemantics.toNumber(r, "+");
    }

    private static double nonZero(double divisor) {
        if (divisor == 0) {
            throw new ExpressionEvaluationException("Division by zero");
        }
        return divisor;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
