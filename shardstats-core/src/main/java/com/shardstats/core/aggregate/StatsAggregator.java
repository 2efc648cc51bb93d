package com.shardstats.core.aggregate;

import com.shardstats.core.config.StatsParams;
import com.shardstats.core.query.CounterQueryResult;
import com.shardstats.core.query.PercentilesQueryResult;
import com.shardstats.core.query.QueryStatus;
import com.shardstats.core.query.ScalarQueryResult;
import com.shardstats.core.query.TimeSeriesBulkQueryResult;
import com.shardstats.core.query.TimeSeriesQueryResult;
import com.shardstats.core.registry.HistogramSlot;
import com.shardstats.core.registry.NameResolver;
import com.shardstats.core.shard.ThreadLocalStatsShard;
import com.shardstats.core.stat.CounterStat;
import com.shardstats.core.stat.ServerCounter;
import com.shardstats.core.stat.ServerHistogram;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.TimeSeriesStat;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns one {@link ThreadLocalStatsShard} per live worker thread and reduces them on demand.
 *
 * <p>Workers write to their own shard ({@link #shard()}) without touching any shared lock. The shard registry is
 * guarded by a read/write lock: registration, deregistration, reset and close take it exclusively, while every
 * reduction holds it shared for its whole walk. A deregistered shard is folded into a retired accumulator inside the
 * same exclusive section, so totals survive thread exit and no reduction ever sees a shard counted twice or half
 * removed.
 *
 * <p>Typical wiring:
 * <pre>{@code
 * StatsAggregator stats = StatsAggregator.create(true);
 * ExecutorService workers = Executors.newFixedThreadPool(8, new StatsWorkerThreadFactory(stats, "io-worker-"));
 * // on a worker
 * stats.add(StreamCounter.APPEND_IN_BYTES, "orders", payload.length);
 * // on the reporting thread
 * CounterQueryResult bytes = stats.getAllCounters(StatCategory.STREAM, "append_in_bytes");
 * }</pre>
 */
@Slf4j
public final class StatsAggregator implements StatsReader, AutoCloseable {

    private final StatsParams params;
    private final Clock clock;
    private final ShardQueries queries;
    private final ReentrantReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final Set<ThreadLocalStatsShard> shards = new HashSet<>();
    private final ThreadLocalStatsShard retired;
    private final ThreadLocal<ThreadLocalStatsShard> current = new ThreadLocal<>();
    private volatile boolean closed;

    public StatsAggregator(StatsParams params, Clock clock) {
        this(params, clock, NameResolver.defaultResolver());
    }

    public StatsAggregator(StatsParams params, Clock clock, NameResolver resolver) {
        this.params = Objects.requireNonNull(params, "params");
        this.clock = Objects.requireNonNull(clock, "clock");
        params.validate();
        this.queries = new ShardQueries(Objects.requireNonNull(resolver, "resolver"), params);
        this.retired = new ThreadLocalStatsShard("retired", params, clock);
        log.info(
                "Created {} stats aggregator intervalPolicy={} maxStreamStatsInterval={} maxSubscriptionStatsInterval={}",
                params.isServer() ? "server" : "client",
                params.getIntervalPolicy(),
                params.getMaxStreamStatsInterval(),
                params.getMaxSubscriptionStatsInterval());
    }

    public static StatsAggregator create(boolean server) {
        return new StatsAggregator(StatsParams.forServer(server), Clock.systemUTC());
    }

    public StatsParams params() {
        return params;
    }

    // ========== Write path ==========

    /**
     * The calling thread's shard, registered on first use.
     *
     * @throws IllegalStateException once the aggregator is closed
     */
    public ThreadLocalStatsShard shard() {
        ThreadLocalStatsShard shard = current.get();
        if (shard != null && !closed) {
            return shard;
        }
        return register();
    }

    /** Writes after {@link #close()} are dropped on every thread. */
    public void add(CounterStat stat, String key, long delta) {
        openShard().ifPresent(shard -> shard.add(stat, key, delta));
    }

    public void record(TimeSeriesStat stat, String key, long delta) {
        openShard().ifPresent(shard -> shard.record(stat, key, delta));
    }

    public void add(ServerCounter counter, long delta) {
        openShard().ifPresent(shard -> shard.add(counter, delta));
    }

    public void addLatency(ServerHistogram histogram, long micros) {
        openShard().ifPresent(shard -> shard.addLatency(histogram, micros));
    }

    // ========== Shard lifecycle ==========

    /** Registers a fully built shard for the calling thread, or returns the one it already has. */
    public ThreadLocalStatsShard register() {
        ThreadLocalStatsShard existing = current.get();
        if (existing != null) {
            if (!closed) {
                return existing;
            }
            current.remove();
        }
        ThreadLocalStatsShard shard = new ThreadLocalStatsShard(Thread.currentThread().getName(), params, clock);
        registryLock.writeLock().lock();
        try {
            ensureOpen();
            shards.add(shard);
        } finally {
            registryLock.writeLock().unlock();
        }
        current.set(shard);
        log.debug("Registered stats shard for thread {}", shard.owner());
        return shard;
    }

    /** Removes the calling thread's shard, keeping its values in the retired totals. No-op if none is registered. */
    public void deregister() {
        ThreadLocalStatsShard shard = current.get();
        if (shard == null) {
            return;
        }
        current.remove();
        registryLock.writeLock().lock();
        try {
            if (shards.remove(shard)) {
                retired.mergeFrom(shard);
            }
        } finally {
            registryLock.writeLock().unlock();
        }
        log.debug("Deregistered stats shard for thread {}", shard.owner());
    }

    public int shardCount() {
        registryLock.readLock().lock();
        try {
            return shards.size();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    // ========== Reduction ==========

    /** Freezes the current cross-shard totals into a snapshot. Rates are evaluated at the capture time. */
    public StatsSnapshot aggregate() {
        return reduce(all -> {
            ThreadLocalStatsShard merged = new ThreadLocalStatsShard("snapshot", params, clock);
            all.forEach(merged::mergeFrom);
            return new StatsSnapshot(merged, clock.millis(), all.size() - 1, queries);
        });
    }

    @Override
    public CounterQueryResult getAllCounters(StatCategory category, String statName) {
        return reduce(all -> queries.getAllCounters(all, category, statName));
    }

    @Override
    public ScalarQueryResult getCounter(StatCategory category, String statName, String key) {
        return reduce(all -> queries.getCounter(all, category, statName, key));
    }

    @Override
    public ScalarQueryResult getCounter(String statName) {
        return reduce(all -> queries.getCounter(all, statName));
    }

    @Override
    public TimeSeriesQueryResult getTimeSeries(
            StatCategory category, String statName, String key, List<Duration> intervals) {
        return reduce(all -> queries.getTimeSeries(all, clock.millis(), category, statName, key, intervals));
    }

    @Override
    public TimeSeriesBulkQueryResult getAllTimeSeries(
            StatCategory category, String statName, List<Duration> intervals) {
        return reduce(all -> queries.getAllTimeSeries(all, clock.millis(), category, statName, intervals));
    }

    /** Adds a sample to the calling thread's shard. */
    @Override
    public QueryStatus histogramAdd(String statName, long micros) {
        Optional<HistogramSlot> slot = queries.resolveHistogram(statName);
        if (slot.isEmpty()) {
            return QueryStatus.NOT_FOUND;
        }
        openShard().ifPresent(shard -> shard.addLatency(slot.get().definition(), micros));
        return QueryStatus.OK;
    }

    @Override
    public long histogramEstimatePercentile(String statName, double percentile) {
        return reduce(all -> queries.histogramEstimatePercentile(all, statName, percentile));
    }

    @Override
    public PercentilesQueryResult histogramEstimatePercentiles(String statName, List<Double> percentiles) {
        return reduce(all -> queries.histogramEstimatePercentiles(all, statName, percentiles));
    }

    /** Zeroes every shard, including the retired totals. */
    public void reset() {
        registryLock.writeLock().lock();
        try {
            retired.reset();
            shards.forEach(ThreadLocalStatsShard::reset);
        } finally {
            registryLock.writeLock().unlock();
        }
        log.info("Reset stats of {} shards", shardCount());
    }

    @Override
    public void close() {
        registryLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            log.info("Closing stats aggregator with {} live shards", shards.size());
            shards.clear();
            retired.reset();
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    private <T> T reduce(Function<List<ThreadLocalStatsShard>, T> query) {
        registryLock.readLock().lock();
        try {
            ensureOpen();
            List<ThreadLocalStatsShard> all = new ArrayList<>(shards.size() + 1);
            all.add(retired);
            all.addAll(shards);
            return query.apply(all);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // empty once closed; drops the calling thread's stale shard
    private Optional<ThreadLocalStatsShard> openShard() {
        if (closed) {
            current.remove();
            return Optional.empty();
        }
        try {
            return Optional.of(shard());
        } catch (IllegalStateException e) {
            if (!closed) {
                throw e;
            }
            // closed between the check and the registration
            return Optional.empty();
        }
    }

    /** Registers the calling thread unless the aggregator is closed. */
    boolean tryRegister() {
        return openShard().isPresent();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Stats aggregator is closed");
        }
    }
}
