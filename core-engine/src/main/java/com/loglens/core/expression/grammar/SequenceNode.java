package com.loglens.core.expression.grammar;

import com.loglens.core.model.LogEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuple or list literal, e.g. {@code ('ERROR', 'CRITICAL')}.
 */
public final class SequenceNode implements ExpressionNode {

    private static final long serialVersionUID = 1L;

    private final ArrayList<ExpressionNode> elements;

    public SequenceNode(List<ExpressionNode> elements) {
        this.elements = new ArrayList<>(elements);
    }

    @Override
    public Object evaluate(LogEvent event) {
        List<Object> values = new ArrayList<>(elements.size());
        for (ExpressionNode element : elements) {
            values.add(element.evaluate(event));
        }
        return values;
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
