package com.shardstats.core.stat;

import java.util.List;

/**
 * Kind of secondary key a per-key block is addressed by.
 */
public enum StatCategory {
    STREAM,
    SUBSCRIPTION;

    public List<CounterStat> counters() {
        return switch (this) {
            case STREAM -> List.of(StreamCounter.values());
            case SUBSCRIPTION -> List.of(SubscriptionCounter.values());
        };
    }

    public List<TimeSeriesStat> timeSeries() {
        return switch (this) {
            case STREAM -> List.of(StreamTimeSeries.values());
            case SUBSCRIPTION -> List.of(SubscriptionTimeSeries.values());
        };
    }
}
