package com.shardstats.core.shard;

import com.shardstats.core.stat.CounterStat;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.TimeSeriesStat;
import com.shardstats.core.timeseries.TimeSeries;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.function.Function;

/**
 * Counters and rate series of one secondary key (a stream name or a subscription id) on one shard.
 *
 * <p>Fields are plain arrays indexed by the stat enum ordinal; the owning thread writes them, the reporting thread
 * reads them. Created lazily by the shard on the first write for the key.
 */
public final class PerKeyStatsBlock {

    private final StatCategory category;
    private final String key;
    private final AtomicLongArray counters;
    private final TimeSeries[] timeSeries;

    PerKeyStatsBlock(
            StatCategory category, String key, Function<TimeSeriesStat, Duration> retention, Duration resolution) {
        this.category = Objects.requireNonNull(category, "category");
        this.key = Objects.requireNonNull(key, "key");
        this.counters = new AtomicLongArray(category.counters().size());
        List<TimeSeriesStat> series = category.timeSeries();
        this.timeSeries = new TimeSeries[series.size()];
        for (TimeSeriesStat stat : series) {
            timeSeries[stat.ordinal()] = new TimeSeries(retention.apply(stat), resolution);
        }
    }

    public StatCategory category() {
        return category;
    }

    public String key() {
        return key;
    }

    public void add(CounterStat stat, long delta) {
        counters.addAndGet(checked(stat).ordinal(), delta);
    }

    public long get(CounterStat stat) {
        return counters.get(checked(stat).ordinal());
    }

    public void record(TimeSeriesStat stat, long delta, long timestampMillis) {
        timeSeries(stat).record(delta, timestampMillis);
    }

    public TimeSeries timeSeries(TimeSeriesStat stat) {
        if (stat.category() != category) {
            throw new IllegalArgumentException(stat + " does not belong to " + category + " stats");
        }
        return timeSeries[stat.ordinal()];
    }

    void mergeFrom(PerKeyStatsBlock other) {
        for (int i = 0; i < counters.length(); i++) {
            counters.addAndGet(i, other.counters.get(i));
        }
        for (int i = 0; i < timeSeries.length; i++) {
            timeSeries[i].mergeFrom(other.timeSeries[i]);
        }
    }

    void reset() {
        for (int i = 0; i < counters.length(); i++) {
            counters.set(i, 0);
        }
        for (TimeSeries series : timeSeries) {
            series.clear();
        }
    }

    private CounterStat checked(CounterStat stat) {
        if (stat.category() != category) {
            throw new IllegalArgumentException(stat + " does not belong to " + category + " stats");
        }
        return stat;
    }
}
