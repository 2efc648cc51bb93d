package com.shardstats.core.aggregate;

import com.shardstats.core.config.IntervalPolicy;
import com.shardstats.core.config.StatsParams;
import com.shardstats.core.histogram.Histogram;
import com.shardstats.core.histogram.HistogramSnapshot;
import com.shardstats.core.query.CounterQueryResult;
import com.shardstats.core.query.PercentilesQueryResult;
import com.shardstats.core.query.QueryStatus;
import com.shardstats.core.query.ScalarQueryResult;
import com.shardstats.core.query.TimeSeriesBulkQueryResult;
import com.shardstats.core.query.TimeSeriesQueryResult;
import com.shardstats.core.registry.CounterSlot;
import com.shardstats.core.registry.HistogramSlot;
import com.shardstats.core.registry.NameResolver;
import com.shardstats.core.registry.ServerCounterSlot;
import com.shardstats.core.registry.TimeSeriesSlot;
import com.shardstats.core.shard.PerKeyStatsBlock;
import com.shardstats.core.shard.ThreadLocalStatsShard;
import com.shardstats.core.stat.StatCategory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cross-shard reductions shared by the live aggregator and snapshots: sum for counters, rate-then-sum for series,
 * merge for histograms. Keys are reported in natural order.
 */
@Slf4j
@RequiredArgsConstructor
final class ShardQueries {

    private final NameResolver resolver;
    private final StatsParams params;

    CounterQueryResult getAllCounters(List<ThreadLocalStatsShard> shards, StatCategory category, String statName) {
        Optional<CounterSlot> resolved = resolver.resolveCounter(category, statName);
        if (resolved.isEmpty()) {
            return CounterQueryResult.failed(notFound(category + " counter", statName));
        }
        CounterSlot slot = resolved.get();
        Map<String, Long> totals = new TreeMap<>();
        for (ThreadLocalStatsShard shard : shards) {
            shard.blocks(category).forEach((key, block) -> totals.merge(key, slot.read(block), Long::sum));
        }
        return CounterQueryResult.of(totals);
    }

    ScalarQueryResult getCounter(
            List<ThreadLocalStatsShard> shards, StatCategory category, String statName, String key) {
        Optional<CounterSlot> resolved = resolver.resolveCounter(category, statName);
        if (resolved.isEmpty()) {
            return ScalarQueryResult.failed(notFound(category + " counter", statName));
        }
        long total = 0;
        if (key != null) {
            for (ThreadLocalStatsShard shard : shards) {
                total += shard.findBlock(category, key).map(resolved.get()::read).orElse(0L);
            }
        }
        return ScalarQueryResult.of(total);
    }

    ScalarQueryResult getCounter(List<ThreadLocalStatsShard> shards, String statName) {
        Optional<ServerCounterSlot> resolved = resolver.resolveServerCounter(statName);
        if (resolved.isEmpty()) {
            return ScalarQueryResult.failed(notFound("server counter", statName));
        }
        long total = 0;
        for (ThreadLocalStatsShard shard : shards) {
            total += resolved.get().read(shard);
        }
        return ScalarQueryResult.of(total);
    }

    TimeSeriesQueryResult getTimeSeries(
            List<ThreadLocalStatsShard> shards,
            long nowMillis,
            StatCategory category,
            String statName,
            String key,
            List<Duration> intervals) {
        Optional<TimeSeriesSlot> resolved = resolver.resolveTimeSeries(category, statName);
        if (resolved.isEmpty()) {
            return TimeSeriesQueryResult.failed(notFound(category + " time series", statName));
        }
        QueryStatus status = checkIntervals(category, key, intervals);
        if (!status.isOk()) {
            return TimeSeriesQueryResult.failed(status);
        }
        double[] rates = new double[intervals.size()];
        if (key != null) {
            for (ThreadLocalStatsShard shard : shards) {
                shard.findBlock(category, key)
                        .ifPresent(block -> accumulate(rates, resolved.get(), block, intervals, nowMillis));
            }
        }
        return TimeSeriesQueryResult.of(boxed(rates));
    }

    TimeSeriesBulkQueryResult getAllTimeSeries(
            List<ThreadLocalStatsShard> shards,
            long nowMillis,
            StatCategory category,
            String statName,
            List<Duration> intervals) {
        Optional<TimeSeriesSlot> resolved = resolver.resolveTimeSeries(category, statName);
        if (resolved.isEmpty()) {
            return TimeSeriesBulkQueryResult.failed(notFound(category + " time series", statName));
        }
        TreeSet<String> keys = new TreeSet<>();
        for (ThreadLocalStatsShard shard : shards) {
            keys.addAll(shard.blocks(category).keySet());
        }
        QueryStatus status = checkIntervals(category, null, intervals);
        for (String key : keys) {
            if (!status.isOk()) {
                break;
            }
            status = checkIntervals(category, key, intervals);
        }
        if (!status.isOk()) {
            return TimeSeriesBulkQueryResult.failed(status);
        }

        Map<String, double[]> ratesByKey = new TreeMap<>();
        for (String key : keys) {
            ratesByKey.put(key, new double[intervals.size()]);
        }
        for (ThreadLocalStatsShard shard : shards) {
            shard.blocks(category).forEach((key, block) -> {
                // keys inserted after the key scan are left out of this reduction
                double[] rates = ratesByKey.get(key);
                if (rates != null) {
                    accumulate(rates, resolved.get(), block, intervals, nowMillis);
                }
            });
        }
        Map<String, List<Double>> result = new TreeMap<>();
        ratesByKey.forEach((key, rates) -> result.put(key, boxed(rates)));
        return TimeSeriesBulkQueryResult.of(result);
    }

    long histogramEstimatePercentile(List<ThreadLocalStatsShard> shards, String statName, double percentile) {
        return mergedHistogram(shards, statName)
                .map(snapshot -> snapshot.estimatePercentile(percentile))
                .orElse(-1L);
    }

    PercentilesQueryResult histogramEstimatePercentiles(
            List<ThreadLocalStatsShard> shards, String statName, List<Double> percentiles) {
        return mergedHistogram(shards, statName)
                .map(snapshot -> PercentilesQueryResult.of(snapshot.estimatePercentiles(percentiles)))
                .orElseGet(() -> PercentilesQueryResult.failed(QueryStatus.NOT_FOUND));
    }

    /** Resolves a histogram name to a slot that exists on this aggregator. */
    Optional<HistogramSlot> resolveHistogram(String statName) {
        Optional<HistogramSlot> resolved = resolver.resolveHistogram(statName);
        if (resolved.isEmpty() || !params.isServer()) {
            notFound("server histogram", statName);
            return Optional.empty();
        }
        return resolved;
    }

    private Optional<HistogramSnapshot> mergedHistogram(List<ThreadLocalStatsShard> shards, String statName) {
        Optional<HistogramSlot> resolved = resolveHistogram(statName);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        HistogramSnapshot merged = HistogramSnapshot.empty(params.getHistogramBuckets());
        for (ThreadLocalStatsShard shard : shards) {
            Optional<HistogramSnapshot> snapshot =
                    resolved.get().histogram(shard).map(Histogram::snapshot);
            if (snapshot.isPresent()) {
                merged = merged.merge(snapshot.get());
            }
        }
        return Optional.of(merged);
    }

    /**
     * Validates intervals for one key, or only their shape when {@code key} is null.
     */
    private QueryStatus checkIntervals(StatCategory category, String key, List<Duration> intervals) {
        if (intervals == null) {
            return QueryStatus.INVALID_INTERVAL;
        }
        for (Duration interval : intervals) {
            if (interval == null || interval.toMillis() <= 0) {
                log.debug("Rejecting {} query with invalid interval {}", category, interval);
                return QueryStatus.INVALID_INTERVAL;
            }
            if (key != null && params.getIntervalPolicy() == IntervalPolicy.REJECT) {
                Duration max = params.maxInterval(category, key);
                if (interval.compareTo(max) > 0) {
                    log.debug(
                            "Requested interval {} for {} '{}' is larger than the max {}",
                            interval,
                            category,
                            key,
                            max);
                    return QueryStatus.INTERVAL_TOO_LARGE;
                }
            }
        }
        return QueryStatus.OK;
    }

    private static void accumulate(
            double[] rates, TimeSeriesSlot slot, PerKeyStatsBlock block, List<Duration> intervals, long nowMillis) {
        double[] shardRates = slot.series(block).rates(intervals, nowMillis);
        for (int i = 0; i < rates.length; i++) {
            rates[i] += shardRates[i];
        }
    }

    private static List<Double> boxed(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }

    private static QueryStatus notFound(String kind, String statName) {
        log.debug("No {} named '{}'", kind, statName);
        return QueryStatus.NOT_FOUND;
    }
}
