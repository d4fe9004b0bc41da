package com.loglens.core.metric;

import java.util.Locale;

/**
 * Built-in aggregations, plus {@link #CUSTOM} for user reducers.
 *
 * @since 1.0.0
 */
public enum AggregationType {

    COUNT("count", false),
    SUM("sum", true),
    AVERAGE("average", true),
    MIN("min", true),
    MAX("max", true),
    PERCENTILE("percentile", true),
    RATE("rate", false),
    UNIQUE_COUNT("unique_count", true),
    CUSTOM("custom", false);

    private final String configName;
    private final boolean requiresValue;

    AggregationType(String configName, boolean requiresValue) {
        this.configName = configName;
        this.requiresValue = requiresValue;
    }

    /**
     * @return the name used in configuration, e.g. {@code unique_count}
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * @return {@code true} if this aggregation needs a value extractor
     */
    public boolean requiresValue() {
        return requiresValue;
    }

    /**
     * Resolve a configuration name. Case-insensitive; {@code avg} and
     * {@code mean} are accepted for {@link #AVERAGE}. {@code custom} is not
     * resolvable from configuration.
     *
     * @throws IllegalArgumentException for an unknown or blank name
     */
    public static AggregationType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Aggregation must not be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "avg":
            case "mean":
                return AVERAGE;
            default:
                break;
        }
        for (AggregationType type : values()) {
            if (type != CUSTOM && type.configName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation: '" + name
                + "'. Expected one of count, sum, average, min, max, percentile, rate, unique_count");
    }
}
