package com.loglens.core.metric;

import java.io.Serializable;
import java.util.Objects;

/**
 * How a metric folds a window's samples into one number: a built-in
 * {@link AggregationType} (with a rank for percentiles) or a named
 * {@link CustomReducer}.
 *
 * @since 1.0.0
 */
public final class Aggregation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AggregationType type;
    private final Double percentile;
    private final String customName;
    private final CustomReducer reducer;

    private Aggregation(AggregationType type, Double percentile, String customName, CustomReducer reducer) {
        this.type = type;
        this.percentile = percentile;
        this.customName = customName;
        this.reducer = reducer;
    }

    /**
     * @throws IllegalArgumentException for {@link AggregationType#PERCENTILE} or
     *         {@link AggregationType#CUSTOM}, which need extra arguments
     */
    public static Aggregation of(AggregationType type) {
        Objects.requireNonNull(type, "Aggregation type must not be null");
        if (type == AggregationType.PERCENTILE) {
            throw new IllegalArgumentException("percentile aggregation needs a rank, use Aggregation.percentile(p)");
        }
        if (type == AggregationType.CUSTOM) {
            throw new IllegalArgumentException("custom aggregation needs a reducer, use Aggregation.custom(name, reducer)");
        }
        return new Aggregation(type, null, null, null);
    }

    /**
     * @param rank percentile rank in [0, 100]
     * @throws IllegalArgumentException if the rank is out of range
     */
    public static Aggregation percentile(double rank) {
        if (Double.isNaN(rank) || rank < 0 || rank > 100) {
            throw new IllegalArgumentException("Percentile must be within [0, 100], got: " + rank);
        }
        return new Aggregation(AggregationType.PERCENTILE, rank, null, null);
    }

    public static Aggregation custom(String name, CustomReducer reducer) {
        Objects.requireNonNull(name, "Custom aggregation name must not be null");
        Objects.requireNonNull(reducer, "Custom reducer must not be null");
        return new Aggregation(AggregationType.CUSTOM, null, name, reducer);
    }

    public AggregationType getType() {
        return type;
    }

    /**
     * @return the percentile rank, or {@code null} unless {@link AggregationType#PERCENTILE}
     */
    public Double getPercentile() {
        return percentile;
    }

    public CustomReducer getReducer() {
        return reducer;
    }

    /**
     * @return {@code true} if samples must carry an extracted value
     */
    public boolean requiresValue() {
        return type.requiresValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Aggregation that))
            return false;
        return type == that.type
                && Objects.equals(percentile, that.percentile)
                && Objects.equals(customName, that.customName)
                && Objects.equals(reducer, that.reducer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, percentile, customName);
    }

    @Override
    public String toString() {
        return switch (type) {
            case PERCENTILE -> "percentile(" + percentile + ")";
            case CUSTOM -> "custom(" + customName + ")";
            default -> type.getConfigName();
        };
    }
}
