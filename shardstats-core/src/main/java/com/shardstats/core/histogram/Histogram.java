package com.shardstats.core.histogram;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.StampedLock;

/**
 * Fixed-bucket latency accumulator.
 *
 * <p>Written by the thread that owns the enclosing shard and read concurrently by the reporting thread. Writers take
 * an uncontended write stamp; readers copy the buckets under an optimistic stamp and only fall back to a read lock
 * when a write overlapped the copy, so a reader never sees counts, sum and max from different moments.
 */
public final class Histogram {

    private final HistogramBuckets buckets;
    private final StampedLock lock = new StampedLock();
    private final long[] counts;
    private long sum;
    private long max;

    public Histogram(HistogramBuckets buckets) {
        this.buckets = Objects.requireNonNull(buckets, "buckets");
        this.counts = new long[buckets.size()];
    }

    public HistogramBuckets buckets() {
        return buckets;
    }

    /** Records one sample. Negative samples (clock skew) are counted as 0. */
    public void add(long value) {
        long sample = Math.max(0, value);
        int index = buckets.indexOf(sample);
        long stamp = lock.writeLock();
        try {
            counts[index]++;
            sum += sample;
            if (sample > max) {
                max = sample;
            }
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void merge(HistogramSnapshot other) {
        if (!buckets.equals(other.buckets())) {
            throw new IllegalArgumentException("Cannot merge histograms with different bucket layouts");
        }
        long stamp = lock.writeLock();
        try {
            for (int i = 0; i < counts.length; i++) {
                counts[i] += other.bucketCount(i);
            }
            sum += other.sum();
            max = Math.max(max, other.max());
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void reset() {
        long stamp = lock.writeLock();
        try {
            Arrays.fill(counts, 0);
            sum = 0;
            max = 0;
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public HistogramSnapshot snapshot() {
        long stamp = lock.tryOptimisticRead();
        if (stamp != 0) {
            long[] copy = counts.clone();
            long copiedSum = sum;
            long copiedMax = max;
            if (lock.validate(stamp)) {
                return new HistogramSnapshot(buckets, copy, copiedSum, copiedMax);
            }
        }
        stamp = lock.readLock();
        try {
            return new HistogramSnapshot(buckets, counts.clone(), sum, max);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public long count() {
        return snapshot().count();
    }

    public long estimatePercentile(double percentile) {
        return snapshot().estimatePercentile(percentile);
    }

    public Percentiles estimatePercentiles(List<Double> percentiles) {
        return snapshot().estimatePercentiles(percentiles);
    }
}
