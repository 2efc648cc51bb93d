package com.shardstats.core.aggregate;

import com.shardstats.core.query.CounterQueryResult;
import com.shardstats.core.query.PercentilesQueryResult;
import com.shardstats.core.query.QueryStatus;
import com.shardstats.core.query.ScalarQueryResult;
import com.shardstats.core.query.TimeSeriesBulkQueryResult;
import com.shardstats.core.query.TimeSeriesQueryResult;
import com.shardstats.core.registry.HistogramSlot;
import com.shardstats.core.shard.ThreadLocalStatsShard;
import com.shardstats.core.stat.StatCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cross-shard totals frozen by {@link StatsAggregator#aggregate()}.
 *
 * <p>Every query answers from the merged copy; rate windows end at {@link #capturedAt()}. Merging series before
 * computing a rate gives the same value as summing per-thread rates because a window's rate is linear in its deltas.
 * {@link #histogramAdd} only changes this snapshot.
 */
public final class StatsSnapshot implements StatsReader {

    private final ThreadLocalStatsShard merged;
    private final List<ThreadLocalStatsShard> view;
    private final long capturedAtMillis;
    private final int shardCount;
    private final ShardQueries queries;

    StatsSnapshot(ThreadLocalStatsShard merged, long capturedAtMillis, int shardCount, ShardQueries queries) {
        this.merged = merged;
        this.view = List.of(merged);
        this.capturedAtMillis = capturedAtMillis;
        this.shardCount = shardCount;
        this.queries = queries;
    }

    public Instant capturedAt() {
        return Instant.ofEpochMilli(capturedAtMillis);
    }

    /** Number of live shards that were reduced into this snapshot. */
    public int shardCount() {
        return shardCount;
    }

    @Override
    public CounterQueryResult getAllCounters(StatCategory category, String statName) {
        return queries.getAllCounters(view, category, statName);
    }

    @Override
    public ScalarQueryResult getCounter(StatCategory category, String statName, String key) {
        return queries.getCounter(view, category, statName, key);
    }

    @Override
    public ScalarQueryResult getCounter(String statName) {
        return queries.getCounter(view, statName);
    }

    @Override
    public TimeSeriesQueryResult getTimeSeries(
            StatCategory category, String statName, String key, List<Duration> intervals) {
        return queries.getTimeSeries(view, capturedAtMillis, category, statName, key, intervals);
    }

    @Override
    public TimeSeriesBulkQueryResult getAllTimeSeries(
            StatCategory category, String statName, List<Duration> intervals) {
        return queries.getAllTimeSeries(view, capturedAtMillis, category, statName, intervals);
    }

    @Override
    public QueryStatus histogramAdd(String statName, long micros) {
        Optional<HistogramSlot> slot = queries.resolveHistogram(statName);
        if (slot.isEmpty()) {
            return QueryStatus.NOT_FOUND;
        }
        merged.addLatency(slot.get().definition(), micros);
        return QueryStatus.OK;
    }

    @Override
    public long histogramEstimatePercentile(String statName, double percentile) {
        return queries.histogramEstimatePercentile(view, statName, percentile);
    }

    @Override
    public PercentilesQueryResult histogramEstimatePercentiles(String statName, List<Double> percentiles) {
        return queries.histogramEstimatePercentiles(view, statName, percentiles);
    }
}
