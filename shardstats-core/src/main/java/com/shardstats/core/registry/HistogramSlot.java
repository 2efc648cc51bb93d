package com.shardstats.core.registry;

import com.shardstats.core.histogram.Histogram;
import com.shardstats.core.shard.ThreadLocalStatsShard;
import com.shardstats.core.stat.ServerHistogram;
import java.util.Optional;

public record HistogramSlot(ServerHistogram definition) implements Slot {

    @Override
    public StatKind kind() {
        return StatKind.SERVER_HISTOGRAM;
    }

    /** Empty on client shards. */
    public Optional<Histogram> histogram(ThreadLocalStatsShard shard) {
        return shard.histogram(definition);
    }
}
