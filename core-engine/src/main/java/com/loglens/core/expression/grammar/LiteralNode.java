package com.loglens.core.expression.grammar;

import com.loglens.core.model.LogEvent;

public final class LiteralNode implements ExpressionNode {

    private static final long serialVersionUID = 1L;

    private final Object value;

    public LiteralNode(Object value) {
        this.value = value;
    }

    @Override
    public Object evaluate(LogEvent event) {
        return value;
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
