package com.shardstats.core.query;

import com.shardstats.core.histogram.Percentiles;
import java.util.List;

/**
 * Batch percentile estimate of a histogram, with its sample count and exact sample sum.
 */
public record PercentilesQueryResult(QueryStatus status, List<Long> estimates, long count, long sum) {

    public PercentilesQueryResult {
        estimates = List.copyOf(estimates);
    }

    public static PercentilesQueryResult of(Percentiles percentiles) {
        return new PercentilesQueryResult(
                QueryStatus.OK, percentiles.values(), percentiles.count(), percentiles.sum());
    }

    public static PercentilesQueryResult failed(QueryStatus status) {
        return new PercentilesQueryResult(status, List.of(), 0, 0);
    }
}
