package com.shardstats.core.registry;

import com.shardstats.core.shard.ThreadLocalStatsShard;
import com.shardstats.core.stat.ServerCounter;

public record ServerCounterSlot(ServerCounter definition) implements Slot {

    @Override
    public StatKind kind() {
        return StatKind.SERVER_COUNTER;
    }

    public long read(ThreadLocalStatsShard shard) {
        return shard.get(definition);
    }
}
