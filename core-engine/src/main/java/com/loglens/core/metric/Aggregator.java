package com.loglens.core.metric;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies an {@link Aggregation} to the samples of an emitted window.
 *
 * <h3>Empty input</h3>
 * <p>
 * {@code count}, {@code rate} and {@code unique_count} yield {@code 0};
 * the value-based aggregations yield {@code null}. Custom reducers are
 * always invoked.
 * </p>
 */
final class Aggregator {

    private Aggregator() {
        // utility class
    }

    static Double aggregate(Aggregation aggregation, List<MetricSample> samples) {
        switch (aggregation.getType()) {
            case COUNT:
                return (double) samples.size();
            case RATE:
                return rate(samples);
            case UNIQUE_COUNT:
                return uniqueCount(samples);
            case CUSTOM:
                return aggregation.getReducer().reduce(samples);
            default:
                break;
        }

        List<Double> values = values(samples);
        if (values.isEmpty()) {
            return null;
        }

        switch (aggregation.getType()) {
            case SUM:
                return sum(values);
            case AVERAGE:
                return sum(values) / values.size();
            case MIN:
                return Collections.min(values);
            case MAX:
                return Collections.max(values);
            case PERCENTILE:
                return percentile(values, aggregation.getPercentile());
            default:
                throw new IllegalStateException("Unhandled aggregation: " + aggregation);
        }
    }

    /**
     * Linear interpolation between the closest ranks, rank = p/100 * (n - 1).
     */
    static double percentile(List<Double> values, double p) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        if (sorted.size() == 1) {
            return sorted.get(0);
        }
        double rank = p / 100.0 * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
    }

    /**
     * Events per second between the earliest and latest sample; a zero span yields the count.
     */
    static double rate(List<MetricSample> samples) {
        if (samples.isEmpty()) {
            return 0.0;
        }
        Instant first = samples.get(0).getTimestamp();
        Instant last = first;
        for (MetricSample sample : samples) {
            Instant ts = sample.getTimestamp();
            if (ts.isBefore(first)) {
                first = ts;
            }
            if (ts.isAfter(last)) {
                last = ts;
            }
        }
        double seconds = Duration.between(first, last).toNanos() / 1_000_000_000.0;
        if (seconds <= 0) {
            return samples.size();
        }
        return samples.size() / seconds;
    }

    private static double uniqueCount(List<MetricSample> samples) {
        Set<Double> distinct = new HashSet<>();
        for (MetricSample sample : samples) {
            if (sample.getValue() != null) {
                distinct.add(sample.getValue());
            }
        }
        return distinct.size();
    }

    private static List<Double> values(List<MetricSample> samples) {
        List<Double> values = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            if (sample.getValue() != null) {
                values.add(sample.getValue());
            }
        }
        return values;
    }

    private static double sum(List<Double> values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
