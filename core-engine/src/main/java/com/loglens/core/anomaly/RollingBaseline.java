package com.loglens.core.anomaly;

import java.io.Serializable;
import java.util.ArrayDeque;

/**
 * Bounded FIFO of recent values with cached population mean and standard
 * deviation. Recomputed in full on every append, O(capacity).
 */
final class RollingBaseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final ArrayDeque<Double> values;
    private double mean;
    private double std;

    RollingBaseline(int capacity) {
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    void append(double value) {
        if (values.size() == capacity) {
            values.pollFirst();
        }
        values.addLast(value);
        recompute();
    }

    int size() {
        return values.size();
    }

    double mean() {
        return mean;
    }

    double std() {
        return std;
    }

    void clear() {
        values.clear();
        mean = 0;
        std = 0;
    }

    private void recompute() {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        mean = sum / values.size();

        double squares = 0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        std = Math.sqrt(squares / values.size());
    }
}
