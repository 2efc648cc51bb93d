package com.shardstats.core.registry;

import com.shardstats.core.stat.ServerCounter;
import com.shardstats.core.stat.ServerHistogram;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.StatDefinition;
import java.util.List;
import java.util.function.Supplier;

/**
 * Which table a stat name is looked up in: the field type (counter, time series, histogram) combined with the block
 * it lives in.
 */
public enum StatKind {
    STREAM_COUNTER(StatCategory.STREAM::counters),
    STREAM_TIME_SERIES(StatCategory.STREAM::timeSeries),
    SUBSCRIPTION_COUNTER(StatCategory.SUBSCRIPTION::counters),
    SUBSCRIPTION_TIME_SERIES(StatCategory.SUBSCRIPTION::timeSeries),
    SERVER_COUNTER(() -> List.of(ServerCounter.values())),
    SERVER_HISTOGRAM(() -> List.of(ServerHistogram.values()));

    private final Supplier<List<? extends StatDefinition>> definitions;

    StatKind(Supplier<List<? extends StatDefinition>> definitions) {
        this.definitions = definitions;
    }

    public List<? extends StatDefinition> definitions() {
        return definitions.get();
    }

    public static StatKind counters(StatCategory category) {
        return switch (category) {
            case STREAM -> STREAM_COUNTER;
            case SUBSCRIPTION -> SUBSCRIPTION_COUNTER;
        };
    }

    public static StatKind timeSeries(StatCategory category) {
        return switch (category) {
            case STREAM -> STREAM_TIME_SERIES;
            case SUBSCRIPTION -> SUBSCRIPTION_TIME_SERIES;
        };
    }
}
