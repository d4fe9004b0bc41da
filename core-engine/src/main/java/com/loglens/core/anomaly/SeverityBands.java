package com.loglens.core.anomaly;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.model.Severity;

import java.io.Serializable;
import java.util.Objects;

/**
 * Maps an absolute z-score to a {@link Severity}, in multiples of the
 * detector threshold.
 *
 * <p>
 * With the defaults (1.5, 2, 3) and a threshold of 2.0: LOW for |z| in
 * [2, 3), MEDIUM for [3, 4), HIGH for [4, 6), CRITICAL from 6.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityBands implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final SeverityBands DEFAULT = new SeverityBands(1.5, 2.0, 3.0);

    private final double medium;
    private final double high;
    private final double critical;

    private SeverityBands(double medium, double high, double critical) {
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    /**
     * @param medium   multiple of the threshold where MEDIUM starts
     * @param high     multiple where HIGH starts
     * @param critical multiple where CRITICAL starts
     * @throws ConfigurationException unless {@code 1 <= medium < high < critical}
     */
    public static SeverityBands of(double medium, double high, double critical) {
        if (!(medium >= 1.0 && medium < high && high < critical)) {
            throw new ConfigurationException("Severity multiples must satisfy 1 <= medium < high < critical, got: "
                    + medium + ", " + high + ", " + critical);
        }
        return new SeverityBands(medium, high, critical);
    }

    /**
     * @param absZ      absolute z-score, at least {@code threshold}
     * @param threshold detector threshold
     */
    public Severity classify(double absZ, double threshold) {
        if (absZ >= critical * threshold) {
            return Severity.CRITICAL;
        }
        if (absZ >= high * threshold) {
            return Severity.HIGH;
        }
        if (absZ >= medium * threshold) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public double getMedium() {
        return medium;
    }

    public double getHigh() {
        return high;
    }

    public double getCritical() {
        return critical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeverityBands that))
            return false;
        return Double.compare(medium, that.medium) == 0
                && Double.compare(high, that.high) == 0
                && Double.compare(critical, that.critical) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(medium, high, critical);
    }

    @Override
    public String toString() {
        return "SeverityBands{medium=" + medium + "x, high=" + high + "x, critical=" + critical + "x}";
    }
}
