package com.loglens.core.expression.grammar;

import com.loglens.core.model.LogEvent;

/**
 * Logical negation ({@code not x}) or arithmetic negation ({@code -x}).
 */
public final class UnaryNode implements ExpressionNode {

    private static final long serialVersionUID = 1L;

    public enum Operator {
        NOT,
        NEGATE
    }

    private final Operator operator;
    private final ExpressionNode operand;

    public UnaryNode(Operator operator, ExpressionNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public Object evaluate(LogEvent event) {
        Object value = operand.evaluate(event);
        if (operator == Operator.NOT) {
            return !ValueSemantics.isTruthy(value);
        }
        return -ValueSemantics.toNumber(value, "-");
    }

    @Override
    public String toString() {
        return (operator == Operator.NOT ? "not " : "-") + operand;
    }
}
