package com.shardstats.spring.autoconfigure;

import com.shardstats.core.config.IntervalPolicy;
import com.shardstats.core.config.StatsParams;
import com.shardstats.core.histogram.HistogramBuckets;
import com.shardstats.core.timeseries.TimeSeries;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code shardstats.*} properties.
 *
 * <pre>
 * shardstats:
 *   server: true
 *   interval-policy: reject
 *   max-stream-stats-interval: 10m
 *   stream-interval-overrides:
 *     audit-log: 1h
 * </pre>
 */
@ConfigurationProperties(prefix = "shardstats")
public class ShardStatsProperties {

    private boolean enabled = true;
    private boolean server = true;
    private IntervalPolicy intervalPolicy = IntervalPolicy.UNCHECKED;
    private Duration maxStreamStatsInterval = StatsParams.DEFAULT_MAX_INTERVAL;
    private Duration maxSubscriptionStatsInterval = StatsParams.DEFAULT_MAX_INTERVAL;
    private Map<String, Duration> streamIntervalOverrides = new LinkedHashMap<>();
    private Map<String, Duration> subscriptionIntervalOverrides = new LinkedHashMap<>();

    /** Upper bound of the last finite 1-2-5 latency bucket, in microseconds. */
    private long histogramMaxMicros = 500_000_000L;

    /** Bucket width of rate series. */
    private Duration timeSeriesResolution = TimeSeries.DEFAULT_RESOLUTION;

    public StatsParams toStatsParams() {
        return StatsParams.builder()
                .server(server)
                .intervalPolicy(intervalPolicy)
                .maxStreamStatsInterval(maxStreamStatsInterval)
                .maxSubscriptionStatsInterval(maxSubscriptionStatsInterval)
                .streamIntervalOverrides(streamIntervalOverrides)
                .subscriptionIntervalOverrides(subscriptionIntervalOverrides)
                .histogramBuckets(HistogramBuckets.oneTwoFive(histogramMaxMicros))
                .timeSeriesResolution(timeSeriesResolution)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isServer() {
        return server;
    }

    public void setServer(boolean server) {
        this.server = server;
    }

    public IntervalPolicy getIntervalPolicy() {
        return intervalPolicy;
    }

    public void setIntervalPolicy(IntervalPolicy intervalPolicy) {
        this.intervalPolicy = intervalPolicy;
    }

    public Duration getMaxStreamStatsInterval() {
        return maxStreamStatsInterval;
    }

    public void setMaxStreamStatsInterval(Duration maxStreamStatsInterval) {
        this.maxStreamStatsInterval = maxStreamStatsInterval;
    }

    public Duration getMaxSubscriptionStatsInterval() {
        return maxSubscriptionStatsInterval;
    }

    public void setMaxSubscriptionStatsInterval(Duration maxSubscriptionStatsInterval) {
        this.maxSubscriptionStatsInterval = maxSubscriptionStatsInterval;
    }

    public Map<String, Duration> getStreamIntervalOverrides() {
        return streamIntervalOverrides;
    }

    public void setStreamIntervalOverrides(Map<String, Duration> streamIntervalOverrides) {
        this.streamIntervalOverrides = streamIntervalOverrides;
    }

    public Map<String, Duration> getSubscriptionIntervalOverrides() {
        return subscriptionIntervalOverrides;
    }

    public void setSubscriptionIntervalOverrides(Map<String, Duration> subscriptionIntervalOverrides) {
        this.subscriptionIntervalOverrides = subscriptionIntervalOverrides;
    }

    public long getHistogramMaxMicros() {
        return histogramMaxMicros;
    }

    public void setHistogramMaxMicros(long histogramMaxMicros) {
        this.histogramMaxMicros = histogramMaxMicros;
    }

    public Duration getTimeSeriesResolution() {
        return timeSeriesResolution;
    }

    public void setTimeSeriesResolution(Duration timeSeriesResolution) {
        this.timeSeriesResolution = timeSeriesResolution;
    }
}
