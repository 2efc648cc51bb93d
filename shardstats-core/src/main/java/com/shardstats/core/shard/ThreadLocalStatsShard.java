package com.shardstats.core.shard;

import com.shardstats.core.config.StatsParams;
import com.shardstats.core.histogram.Histogram;
import com.shardstats.core.stat.CounterStat;
import com.shardstats.core.stat.ServerCounter;
import com.shardstats.core.stat.ServerHistogram;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.TimeSeriesStat;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Stats owned by one worker thread: per-key blocks for every {@link StatCategory}, server scalar counters and, on
 * server aggregators, the latency histograms.
 *
 * <p>Only the owning thread inserts blocks and writes values. The reporting thread reads concurrently; a key inserted
 * while a reduction walks the block table may or may not be part of that reduction.
 */
public final class ThreadLocalStatsShard {

    private final String owner;
    private final StatsParams params;
    private final Clock clock;
    private final EnumMap<StatCategory, ConcurrentMap<String, PerKeyStatsBlock>> blocks =
            new EnumMap<>(StatCategory.class);
    private final AtomicLongArray serverCounters = new AtomicLongArray(ServerCounter.values().length);
    private final EnumMap<ServerHistogram, Histogram> histograms = new EnumMap<>(ServerHistogram.class);

    public ThreadLocalStatsShard(String owner, StatsParams params, Clock clock) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.params = Objects.requireNonNull(params, "params");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (StatCategory category : StatCategory.values()) {
            blocks.put(category, new ConcurrentHashMap<>());
        }
        if (params.isServer()) {
            for (ServerHistogram histogram : ServerHistogram.values()) {
                histograms.put(histogram, new Histogram(params.getHistogramBuckets()));
            }
        }
    }

    /** Name of the thread the shard belongs to. */
    public String owner() {
        return owner;
    }

    public PerKeyStatsBlock stream(String streamName) {
        return block(StatCategory.STREAM, streamName);
    }

    public PerKeyStatsBlock subscription(String subscriptionId) {
        return block(StatCategory.SUBSCRIPTION, subscriptionId);
    }

    /** Returns the block for {@code key}, creating it on first use. */
    public PerKeyStatsBlock block(StatCategory category, String key) {
        ConcurrentMap<String, PerKeyStatsBlock> table = blocks.get(category);
        PerKeyStatsBlock block = table.get(key);
        if (block != null) {
            return block;
        }
        return table.computeIfAbsent(
                key,
                k -> new PerKeyStatsBlock(
                        category, k, stat -> params.retention(stat, k), params.getTimeSeriesResolution()));
    }

    public Optional<PerKeyStatsBlock> findBlock(StatCategory category, String key) {
        return Optional.ofNullable(blocks.get(category).get(key));
    }

    /** Read-only live view of the blocks of one category. */
    public Map<String, PerKeyStatsBlock> blocks(StatCategory category) {
        return Collections.unmodifiableMap(blocks.get(category));
    }

    public void add(CounterStat stat, String key, long delta) {
        block(stat.category(), key).add(stat, delta);
    }

    public void record(TimeSeriesStat stat, String key, long delta) {
        record(stat, key, delta, clock.millis());
    }

    public void record(TimeSeriesStat stat, String key, long delta, long timestampMillis) {
        block(stat.category(), key).record(stat, delta, timestampMillis);
    }

    public void add(ServerCounter counter, long delta) {
        serverCounters.addAndGet(counter.ordinal(), delta);
    }

    public long get(ServerCounter counter) {
        return serverCounters.get(counter.ordinal());
    }

    /** Empty on client shards. */
    public Optional<Histogram> histogram(ServerHistogram histogram) {
        return Optional.ofNullable(histograms.get(histogram));
    }

    /** Records a latency sample; a no-op returning {@code false} on client shards. */
    public boolean addLatency(ServerHistogram histogram, long micros) {
        Histogram target = histograms.get(histogram);
        if (target == null) {
            return false;
        }
        target.add(micros);
        return true;
    }

    /**
     * Adds everything {@code other} holds into this shard. The caller guarantees nobody writes to this shard
     * concurrently.
     */
    public void mergeFrom(ThreadLocalStatsShard other) {
        for (StatCategory category : StatCategory.values()) {
            other.blocks.get(category).forEach((key, block) -> block(category, key).mergeFrom(block));
        }
        for (int i = 0; i < serverCounters.length(); i++) {
            serverCounters.addAndGet(i, other.serverCounters.get(i));
        }
        histograms.forEach((name, histogram) -> other.histogram(name)
                .ifPresent(source -> histogram.merge(source.snapshot())));
    }

    /** Zeroes every value; blocks stay allocated. */
    public void reset() {
        blocks.values().forEach(table -> table.values().forEach(PerKeyStatsBlock::reset));
        for (int i = 0; i < serverCounters.length(); i++) {
            serverCounters.set(i, 0);
        }
        histograms.values().forEach(Histogram::reset);
    }

    @Override
    public String toString() {
        return "ThreadLocalStatsShard{owner=" + owner + "}";
    }
}
