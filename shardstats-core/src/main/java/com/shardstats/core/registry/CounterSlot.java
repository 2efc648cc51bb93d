package com.shardstats.core.registry;

import com.shardstats.core.shard.PerKeyStatsBlock;
import com.shardstats.core.stat.CounterStat;
import com.shardstats.core.stat.StatCategory;

public record CounterSlot(CounterStat definition) implements Slot {

    @Override
    public StatKind kind() {
        return StatKind.counters(definition.category());
    }

    public StatCategory category() {
        return definition.category();
    }

    public long read(PerKeyStatsBlock block) {
        return block.get(definition);
    }
}
