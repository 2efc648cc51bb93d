package com.shardstats.core.config;

import com.shardstats.core.histogram.HistogramBuckets;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.TimeSeriesStat;
import com.shardstats.core.timeseries.TimeSeries;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Settings consumed by the aggregation engine.
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * StatsParams params = StatsParams.builder()
 *         .server(true)
 *         .intervalPolicy(IntervalPolicy.REJECT)
 *         .maxStreamStatsInterval(Duration.ofMinutes(10))
 *         .streamIntervalOverride("audit-log", Duration.ofHours(1))
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class StatsParams {

    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMinutes(10);

    /** Server aggregators carry latency histograms; client aggregators do not. */
    @Builder.Default
    boolean server = true;

    @Builder.Default
    IntervalPolicy intervalPolicy = IntervalPolicy.UNCHECKED;

    @Builder.Default
    Duration maxStreamStatsInterval = DEFAULT_MAX_INTERVAL;

    @Builder.Default
    Duration maxSubscriptionStatsInterval = DEFAULT_MAX_INTERVAL;

    /** Per stream name maximum query interval, overriding {@link #maxStreamStatsInterval}. */
    @Singular("streamIntervalOverride")
    Map<String, Duration> streamIntervalOverrides;

    /** Per subscription id maximum query interval, overriding {@link #maxSubscriptionStatsInterval}. */
    @Singular("subscriptionIntervalOverride")
    Map<String, Duration> subscriptionIntervalOverrides;

    @Builder.Default
    HistogramBuckets histogramBuckets = HistogramBuckets.LATENCY_MICROS;

    /** Bucket width of rate series; rate windows start on a bucket boundary. */
    @Builder.Default
    Duration timeSeriesResolution = TimeSeries.DEFAULT_RESOLUTION;

    public static StatsParams defaults() {
        return builder().build();
    }

    public static StatsParams forServer(boolean server) {
        return builder().server(server).build();
    }

    /** Largest interval a rate query for {@code key} may ask for. */
    public Duration maxInterval(StatCategory category, String key) {
        return switch (category) {
            case STREAM -> streamIntervalOverrides.getOrDefault(key, maxStreamStatsInterval);
            case SUBSCRIPTION -> subscriptionIntervalOverrides.getOrDefault(key, maxSubscriptionStatsInterval);
        };
    }

    /** How long a series for {@code key} keeps buckets: long enough for its own intervals and the key's maximum. */
    public Duration retention(TimeSeriesStat stat, String key) {
        Duration configured = maxInterval(stat.category(), key);
        Duration own = stat.maxInterval();
        return configured.compareTo(own) > 0 ? configured : own;
    }

    public void validate() {
        Objects.requireNonNull(intervalPolicy, "intervalPolicy");
        Objects.requireNonNull(histogramBuckets, "histogramBuckets");
        requirePositive("maxStreamStatsInterval", maxStreamStatsInterval);
        requirePositive("maxSubscriptionStatsInterval", maxSubscriptionStatsInterval);
        if (timeSeriesResolution == null || timeSeriesResolution.toMillis() < 1) {
            throw new IllegalArgumentException(
                    "timeSeriesResolution must be at least 1ms but was " + timeSeriesResolution);
        }
        streamIntervalOverrides.forEach((key, interval) -> requirePositive("stream interval for " + key, interval));
        subscriptionIntervalOverrides.forEach(
                (key, interval) -> requirePositive("subscription interval for " + key, interval));
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration but was " + value);
        }
    }
}
