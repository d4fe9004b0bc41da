package com.loglens.core.expression.grammar;

import com.loglens.core.model.LogEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads an event attribute, optionally descending into metadata.
 *
 * <p>
 * {@code event.timestamp} yields epoch milliseconds and {@code event.level}
 * the level name. Metadata paths walk nested maps by key and lists by
 * numeric index; a missing key or index yields {@code null}.
 * </p>
 */
public final class EventFieldNode implements ExpressionNode {

    private static final long serialVersionUID = 1L;

    static final Set<String> ATTRIBUTES = Set.of("timestamp", "level", "source", "message", "metadata");

    private final String attribute;
    private final ArrayList<String> path;

    public EventFieldNode(String attribute, List<String> path) {
        this.attribute = attribute;
        this.path = new ArrayList<>(path);
    }

    @Override
    public Object evaluate(LogEvent event) {
        Object current = switch (attribute) {
            case "timestamp" -> event.getTimestamp().toEpochMilli();
            case "level" -> event.getLevel().name();
            case "source" -> event.getSource();
            case "message" -> event.getMessage();
            default -> event.getMetadata();
        };

        for (String segment : path) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment)) {
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("event.").append(attribute);
        for (String segment : path) {
            sb.append("['").append(segment).append("']");
        }
        return sb.toString();
    }
}
