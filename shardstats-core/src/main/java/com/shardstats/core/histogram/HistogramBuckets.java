package com.shardstats.core.histogram;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable bucket layout shared by every histogram of one kind.
 *
 * <p>Each bucket is described by its inclusive lower bound. The first bound is always {@code 0} and bounds are
 * strictly increasing, so the layout covers {@code [0, Long.MAX_VALUE]}; the last bucket is open ended.
 */
public final class HistogramBuckets {

    /** Latency layout in microseconds: 0, 1, 2, 5, 10, 20, 50, ... up to 500 seconds. */
    public static final HistogramBuckets LATENCY_MICROS = oneTwoFive(500_000_000L);

    private final long[] lowerBounds;

    private HistogramBuckets(long[] lowerBounds) {
        this.lowerBounds = lowerBounds;
    }

    public static HistogramBuckets of(long... lowerBounds) {
        if (lowerBounds == null || lowerBounds.length == 0) {
            throw new IllegalArgumentException("At least one bucket bound is required");
        }
        if (lowerBounds[0] != 0) {
            throw new IllegalArgumentException("First bucket must start at 0 but starts at " + lowerBounds[0]);
        }
        for (int i = 1; i < lowerBounds.length; i++) {
            if (lowerBounds[i] <= lowerBounds[i - 1]) {
                throw new IllegalArgumentException("Bucket bounds must be strictly increasing at index " + i + ": "
                        + lowerBounds[i - 1] + " >= " + lowerBounds[i]);
            }
        }
        return new HistogramBuckets(lowerBounds.clone());
    }

    /** Builds a {@code 0, 1, 2, 5, 10, 20, 50, ...} layout whose largest finite bound does not exceed {@code max}. */
    public static HistogramBuckets oneTwoFive(long max) {
        if (max < 1) {
            throw new IllegalArgumentException("max must be positive: " + max);
        }
        List<Long> bounds = new ArrayList<>();
        bounds.add(0L);
        for (long decade = 1; decade > 0 && decade <= max; decade *= 10) {
            for (long step : new long[] {1, 2, 5}) {
                long bound = decade * step;
                if (bound > max) {
                    break;
                }
                bounds.add(bound);
            }
            if (decade > Long.MAX_VALUE / 10) {
                break;
            }
        }
        return of(bounds.stream().mapToLong(Long::longValue).toArray());
    }

    public int size() {
        return lowerBounds.length;
    }

    public long lowerBound(int index) {
        return lowerBounds[index];
    }

    /** Exclusive upper bound of the bucket; {@link Long#MAX_VALUE} for the open-ended last bucket. */
    public long upperBound(int index) {
        return index + 1 < lowerBounds.length ? lowerBounds[index + 1] : Long.MAX_VALUE;
    }

    /** Index of the bucket whose range contains {@code value}. Negative values land in the first bucket. */
    public int indexOf(long value) {
        if (value <= 0) {
            return 0;
        }
        int found = Arrays.binarySearch(lowerBounds, value);
        return found >= 0 ? found : -found - 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistogramBuckets)) return false;
        return Arrays.equals(lowerBounds, ((HistogramBuckets) o).lowerBounds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(lowerBounds);
    }

    @Override
    public String toString() {
        return "HistogramBuckets" + Arrays.toString(lowerBounds);
    }
}
