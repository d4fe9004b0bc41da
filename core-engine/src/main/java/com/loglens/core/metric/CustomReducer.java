package com.loglens.core.metric;

import java.io.Serializable;
import java.util.List;

/**
 * User-supplied aggregation over a window's samples.
 *
 * @see Aggregation#custom(String, CustomReducer)
 */
@FunctionalInterface
public interface CustomReducer extends Serializable {

    /**
     * @param samples samples of the emitted window, in admission order; may be empty
     * @return the aggregate value
     */
    double reduce(List<MetricSample> samples);
}
