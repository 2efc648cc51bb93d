package com.shardstats.core.stat;

import java.util.Set;

/** Server-wide scalar counters, one value per shard. */
public enum ServerCounter implements StatDefinition {
    APPEND_REQUESTS("append_requests"),
    READ_REQUESTS("read_requests"),
    SUBSCRIPTION_REQUESTS("subscription_requests");

    private final String statName;

    ServerCounter(String statName) {
        this.statName = statName;
    }

    @Override
    public String statName() {
        return statName;
    }

    @Override
    public Set<String> aliases() {
        return Set.of(statName);
    }
}
