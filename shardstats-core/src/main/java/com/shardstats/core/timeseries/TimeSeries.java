package com.shardstats.core.timeseries;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.StampedLock;

/**
 * Counter deltas for one (secondary key, slot) pair on one thread, summed into fixed-width buckets.
 *
 * <p>Buckets are aligned to the epoch: bucket {@code b} covers {@code [b * resolution, (b + 1) * resolution)}. The
 * ring holds enough buckets to cover the retention window plus the bucket in progress, and is allocated on the first
 * write. A write adds to one bucket; a bucket that has fallen out of the ring is reused by the write that lands on
 * its slot, so eviction needs no extra work. A query visits at most one ring's worth of buckets.
 *
 * <p>Window edges have the precision of the resolution: a bucket counts toward {@code [now - interval, now]} when its
 * start falls inside that range.
 */
public final class TimeSeries {

    public static final Duration DEFAULT_RESOLUTION = Duration.ofSeconds(1);

    private static final long NO_BUCKET = Long.MIN_VALUE;

    private final long retentionMillis;
    private final long resolutionMillis;
    private final int capacity;
    private final StampedLock lock = new StampedLock();
    private long[] bucketIds;
    private long[] totals;
    private long newestBucket = NO_BUCKET;

    public TimeSeries(Duration retention) {
        this(retention, DEFAULT_RESOLUTION);
    }

    public TimeSeries(Duration retention, Duration resolution) {
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(resolution, "resolution");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive: " + retention);
        }
        if (resolution.toMillis() < 1) {
            throw new IllegalArgumentException("resolution must be at least 1ms: " + resolution);
        }
        this.retentionMillis = retention.toMillis();
        this.resolutionMillis = resolution.toMillis();
        long buckets = (retentionMillis + resolutionMillis - 1) / resolutionMillis + 1;
        if (buckets > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("retention " + retention + " needs too many buckets of " + resolution);
        }
        this.capacity = (int) buckets;
    }

    public Duration retention() {
        return Duration.ofMillis(retentionMillis);
    }

    public Duration resolution() {
        return Duration.ofMillis(resolutionMillis);
    }

    /** Number of buckets in the ring. */
    public int capacity() {
        return capacity;
    }

    /**
     * Adds {@code delta} to the bucket containing {@code timestampMillis}. A timestamp older than the ring is dropped:
     * no query can reach it any more.
     */
    public void record(long delta, long timestampMillis) {
        long stamp = lock.writeLock();
        try {
            add(Math.floorDiv(timestampMillis, resolutionMillis), delta);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Per-second rate over {@code [now - interval, now]}: the sum of deltas in the window divided by the interval.
     * Returns 0 when no delta falls in the window.
     */
    public double rate(Duration interval, long nowMillis) {
        return rates(List.of(interval), nowMillis)[0];
    }

    /** {@link #rate(Duration, long)} for several intervals, computed under one read of the ring. */
    public double[] rates(List<Duration> intervals, long nowMillis) {
        long[] windowSums = sums(intervals, nowMillis);
        double[] rates = new double[windowSums.length];
        for (int i = 0; i < windowSums.length; i++) {
            rates[i] = toRate(windowSums[i], intervals.get(i));
        }
        return rates;
    }

    /** Sum of the buckets whose start falls in {@code [now - interval, now]}, per interval. */
    public long[] sums(List<Duration> intervals, long nowMillis) {
        long[] lowerBounds = new long[intervals.size()];
        long oldest = nowMillis;
        for (int i = 0; i < lowerBounds.length; i++) {
            Duration interval = intervals.get(i);
            if (interval == null || interval.toMillis() <= 0) {
                throw new IllegalArgumentException("Query interval must be at least 1ms: " + interval);
            }
            lowerBounds[i] = nowMillis - interval.toMillis();
            oldest = Math.min(oldest, lowerBounds[i]);
        }
        long[] windowSums = new long[lowerBounds.length];
        long stamp = lock.readLock();
        try {
            if (bucketIds == null) {
                return windowSums;
            }
            long from = Math.max(Math.floorDiv(oldest + resolutionMillis - 1, resolutionMillis), oldestBucket());
            long to = Math.min(Math.floorDiv(nowMillis, resolutionMillis), newestBucket);
            for (long bucket = to; bucket >= from; bucket--) {
                int slot = slot(bucket);
                if (bucketIds[slot] != bucket) {
                    continue;
                }
                long start = bucket * resolutionMillis;
                for (int i = 0; i < lowerBounds.length; i++) {
                    if (start >= lowerBounds[i]) {
                        windowSums[i] += totals[slot];
                    }
                }
            }
        } finally {
            lock.unlockRead(stamp);
        }
        return windowSums;
    }

    /** Adds every retained bucket of {@code other} into this series. Both must share one resolution. */
    public void mergeFrom(TimeSeries other) {
        if (other == this) {
            return;
        }
        if (other.resolutionMillis != resolutionMillis) {
            throw new IllegalArgumentException("Cannot merge series with resolutions " + resolution() + " and "
                    + other.resolution());
        }
        long[][] copied = other.copyBuckets();
        long stamp = lock.writeLock();
        try {
            for (int i = 0; i < copied[0].length; i++) {
                add(copied[0][i], copied[1][i]);
            }
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void clear() {
        long stamp = lock.writeLock();
        try {
            bucketIds = null;
            totals = null;
            newestBucket = NO_BUCKET;
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /** Buckets inside the ring that received at least one write. */
    public int activeBuckets() {
        long stamp = lock.readLock();
        try {
            if (bucketIds == null) {
                return 0;
            }
            int active = 0;
            long oldestBucket = oldestBucket();
            for (long id : bucketIds) {
                if (id != NO_BUCKET && id >= oldestBucket) {
                    active++;
                }
            }
            return active;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** Per-second rate of {@code sum} over {@code interval}, at the interval's full precision. */
    public static double toRate(long sum, Duration interval) {
        if (sum == 0) {
            return 0.0d;
        }
        return sum * 1e9d / interval.toNanos();
    }

    // oldest-first, so merging replays buckets in time order
    private long[][] copyBuckets() {
        long stamp = lock.readLock();
        try {
            if (bucketIds == null) {
                return new long[][] {new long[0], new long[0]};
            }
            long[] ids = new long[capacity];
            long[] values = new long[capacity];
            int n = 0;
            for (long bucket = oldestBucket(); bucket <= newestBucket; bucket++) {
                int slot = slot(bucket);
                if (bucketIds[slot] == bucket) {
                    ids[n] = bucket;
                    values[n] = totals[slot];
                    n++;
                }
            }
            return new long[][] {Arrays.copyOf(ids, n), Arrays.copyOf(values, n)};
        } finally {
            lock.unlockRead(stamp);
        }
    }

    // caller holds the write lock
    private void add(long bucket, long delta) {
        if (bucketIds == null) {
            bucketIds = new long[capacity];
            totals = new long[capacity];
            Arrays.fill(bucketIds, NO_BUCKET);
        }
        if (newestBucket != NO_BUCKET && bucket <= newestBucket - capacity) {
            return;
        }
        int slot = slot(bucket);
        if (bucketIds[slot] != bucket) {
            assert bucketIds[slot] == NO_BUCKET || bucketIds[slot] < bucket;
            bucketIds[slot] = bucket;
            totals[slot] = 0;
        }
        totals[slot] += delta;
        if (newestBucket == NO_BUCKET || bucket > newestBucket) {
            newestBucket = bucket;
        }
    }

    private long oldestBucket() {
        return newestBucket - capacity + 1;
    }

    private int slot(long bucket) {
        return (int) Math.floorMod(bucket, (long) capacity);
    }
}
