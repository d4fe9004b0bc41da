package com.loglens.core.anomaly;

import java.io.Serializable;
import java.util.Objects;

/**
 * Point-in-time summary of a detector's baseline. Immutable.
 */
public final class BaselineStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double stdDev;
    private final int sampleCount;
    private final int windowSize;
    private final DetectorState state;

    public BaselineStats(double mean, double stdDev, int sampleCount, int windowSize, DetectorState state) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.sampleCount = sampleCount;
        this.windowSize = windowSize;
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * @return population mean of the held values, {@code 0} when empty
     */
    public double getMean() {
        return mean;
    }

    /**
     * @return population standard deviation of the held values, {@code 0} when empty
     */
    public double getStdDev() {
        return stdDev;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public DetectorState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineStats that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && sampleCount == that.sampleCount
                && windowSize == that.windowSize
                && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, sampleCount, windowSize, state);
    }

    @Override
    public String toString() {
        return "BaselineStats{mean=" + mean + ", stdDev=" + stdDev + ", samples=" + sampleCount
                + "/" + windowSize + ", state=" + state + '}';
    }
}
