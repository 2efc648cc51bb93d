package com.shardstats.core.aggregate;

import com.shardstats.core.query.CounterQueryResult;
import com.shardstats.core.query.PercentilesQueryResult;
import com.shardstats.core.query.QueryStatus;
import com.shardstats.core.query.ScalarQueryResult;
import com.shardstats.core.query.TimeSeriesBulkQueryResult;
import com.shardstats.core.query.TimeSeriesQueryResult;
import com.shardstats.core.stat.StatCategory;
import java.time.Duration;
import java.util.List;

/**
 * Name-addressed stats queries. Implemented by {@link StatsAggregator}, which reduces the live shards on every call,
 * and by {@link StatsSnapshot}, which answers from a reduction frozen at {@link StatsAggregator#aggregate()} time.
 *
 * <p>No method throws for an unknown name: the result carries {@link QueryStatus#NOT_FOUND} and empty output.
 */
public interface StatsReader {

    /** Total of one per-key counter for every key present on any shard. A key absent on a shard counts as 0 there. */
    CounterQueryResult getAllCounters(StatCategory category, String statName);

    /** Total of one per-key counter for a single key; 0 when no shard has seen the key. */
    ScalarQueryResult getCounter(StatCategory category, String statName, String key);

    /** Total of one server scalar counter across shards. */
    ScalarQueryResult getCounter(String statName);

    /** Per-second rate of one key over each interval, summed across shards. Same length and order as the input. */
    TimeSeriesQueryResult getTimeSeries(
            StatCategory category, String statName, String key, List<Duration> intervals);

    /** {@link #getTimeSeries} for the union of keys present on any shard. */
    TimeSeriesBulkQueryResult getAllTimeSeries(StatCategory category, String statName, List<Duration> intervals);

    QueryStatus histogramAdd(String statName, long micros);

    /** Estimated value at {@code percentile} (0 to 1), 0 for an empty histogram, or -1 if the name does not resolve. */
    long histogramEstimatePercentile(String statName, double percentile);

    PercentilesQueryResult histogramEstimatePercentiles(String statName, List<Double> percentiles);
}
