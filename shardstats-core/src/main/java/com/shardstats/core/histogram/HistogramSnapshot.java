package com.shardstats.core.histogram;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Point-in-time copy of a {@link Histogram}.
 *
 * <p>Because individual samples are not kept, percentiles are estimated: the bucket holding the requested rank is
 * located exactly, then the value is linearly interpolated inside that bucket. The upper end of the interpolation
 * range is capped by the largest value ever recorded, which also bounds the open-ended last bucket.
 */
public final class HistogramSnapshot {

    private final HistogramBuckets buckets;
    private final long[] counts;
    private final long count;
    private final long sum;
    private final long max;

    HistogramSnapshot(HistogramBuckets buckets, long[] counts, long sum, long max) {
        this.buckets = Objects.requireNonNull(buckets, "buckets");
        this.counts = counts;
        this.count = Arrays.stream(counts).sum();
        this.sum = sum;
        this.max = max;
    }

    public static HistogramSnapshot empty(HistogramBuckets buckets) {
        return new HistogramSnapshot(buckets, new long[buckets.size()], 0, 0);
    }

    public HistogramBuckets buckets() {
        return buckets;
    }

    public long count() {
        return count;
    }

    public long sum() {
        return sum;
    }

    public long max() {
        return max;
    }

    public long bucketCount(int index) {
        return counts[index];
    }

    /** Combines two snapshots over the same bucket layout. */
    public HistogramSnapshot merge(HistogramSnapshot other) {
        if (!buckets.equals(other.buckets)) {
            throw new IllegalArgumentException("Cannot merge histograms with different bucket layouts");
        }
        long[] merged = new long[counts.length];
        for (int i = 0; i < merged.length; i++) {
            merged[i] = counts[i] + other.counts[i];
        }
        return new HistogramSnapshot(buckets, merged, sum + other.sum, Math.max(max, other.max));
    }

    /**
     * Estimates the sample value at {@code percentile} (0 to 1, clamped). Returns 0 when the histogram is empty.
     *
     * <p>Prefer {@link #estimatePercentiles(List)} for several percentiles: it walks the buckets once.
     */
    public long estimatePercentile(double percentile) {
        if (count == 0) {
            return 0;
        }
        double target = clamp(percentile) * count;
        long cumulative = 0;
        int lastNonEmpty = -1;
        for (int i = 0; i < counts.length; i++) {
            long bucketCount = counts[i];
            if (bucketCount == 0) {
                continue;
            }
            lastNonEmpty = i;
            if (cumulative + bucketCount >= target) {
                return interpolate(i, cumulative, bucketCount, target);
            }
            cumulative += bucketCount;
        }
        return interpolate(lastNonEmpty, cumulative - counts[lastNonEmpty], counts[lastNonEmpty], count);
    }

    /**
     * Single-pass form of {@link #estimatePercentile(double)}; each value equals the one the single call returns.
     */
    public Percentiles estimatePercentiles(List<Double> percentiles) {
        long[] estimates = new long[percentiles.size()];
        if (count > 0 && !percentiles.isEmpty()) {
            Integer[] order = IntStream.range(0, percentiles.size()).boxed().toArray(Integer[]::new);
            Arrays.sort(order, Comparator.comparingDouble(i -> clamp(percentiles.get(i))));

            int next = 0;
            long cumulative = 0;
            int lastNonEmpty = -1;
            for (int i = 0; i < counts.length && next < order.length; i++) {
                long bucketCount = counts[i];
                if (bucketCount == 0) {
                    continue;
                }
                lastNonEmpty = i;
                while (next < order.length) {
                    double target = clamp(percentiles.get(order[next])) * count;
                    if (cumulative + bucketCount < target) {
                        break;
                    }
                    estimates[order[next++]] = interpolate(i, cumulative, bucketCount, target);
                }
                cumulative += bucketCount;
            }
            while (next < order.length) {
                estimates[order[next++]] = interpolate(
                        lastNonEmpty, cumulative - counts[lastNonEmpty], counts[lastNonEmpty], count);
            }
        }
        List<Long> values = new ArrayList<>(estimates.length);
        for (long estimate : estimates) {
            values.add(estimate);
        }
        return new Percentiles(values, count, sum);
    }

    private long interpolate(int bucket, long cumulativeBefore, long bucketCount, double target) {
        long lower = buckets.lowerBound(bucket);
        long upper = Math.max(lower, Math.min(buckets.upperBound(bucket), max));
        double fraction = (target - cumulativeBefore) / bucketCount;
        fraction = Math.min(1.0d, Math.max(0.0d, fraction));
        return lower + Math.round(fraction * (upper - lower));
    }

    private static double clamp(double percentile) {
        if (Double.isNaN(percentile)) {
            return 0.0d;
        }
        return Math.min(1.0d, Math.max(0.0d, percentile));
    }
}
