package com.shardstats.core.query;

import java.util.List;

/**
 * Cross-thread rates for one key, in the order the intervals were requested.
 */
public record TimeSeriesQueryResult(QueryStatus status, List<Double> rates) {

    public TimeSeriesQueryResult {
        rates = List.copyOf(rates);
    }

    public static TimeSeriesQueryResult of(List<Double> rates) {
        return new TimeSeriesQueryResult(QueryStatus.OK, rates);
    }

    public static TimeSeriesQueryResult failed(QueryStatus status) {
        return new TimeSeriesQueryResult(status, List.of());
    }
}
