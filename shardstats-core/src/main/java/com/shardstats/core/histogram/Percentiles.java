package com.shardstats.core.histogram;

import java.util.List;

/**
 * Batch percentile estimate.
 *
 * @param values estimates in the order the percentiles were requested
 * @param count total number of samples
 * @param sum exact sum of all recorded samples
 */
public record Percentiles(List<Long> values, long count, long sum) {

    public Percentiles {
        values = List.copyOf(values);
    }
}
