package com.loglens.core.expression.grammar;

import com.loglens.core.expression.ExpressionEvaluationException;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Truthiness, equality, ordering and membership rules shared by the nodes.
 */
public final class ValueSemantics {

    private ValueSemantics() {}

    /**
     * {@code null}, {@code false}, zero, the empty string and empty
     * collections are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /** Numbers compare by value regardless of their boxed type. */
    static boolean areEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        return Objects.equals(a, b);
    }

    static int compare(Object a, Object b, String operator) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        throw new ExpressionEvaluationException("Cannot apply '" + operator + "' to "
                + describe(a) + " and " + describe(b));
    }

    /**
     * Substring test for strings, membership for collections, key lookup for maps.
     */
    static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (!(item instanceof String needle)) {
                throw new ExpressionEvaluationException(
                        "'in <string>' requires a string on the left, got " + describe(item));
            }
            return s.contains(needle);
        }
        if (container instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (areEqual(element, item)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(item);
        }
        throw new ExpressionEvaluationException("Argument of type " + describe(container)
                + " is not a container");
    }

    static double toNumber(Object value, String operator) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ExpressionEvaluationException("Unsupported operand for '" + operator + "': "
                + describe(value));
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number) {
            return "number " + value;
        }
        if (value instanceof String) {
            return "string '" + value + "'";
        }
        return value.getClass().getSimpleName().toLowerCase() + " " + value;
    }
}
