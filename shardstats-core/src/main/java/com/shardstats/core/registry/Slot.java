package com.shardstats.core.registry;

import com.shardstats.core.stat.StatDefinition;

/**
 * Typed handle to one stat field, obtained from {@link NameResolver} once per query and then used to read that field
 * on every shard.
 */
public sealed interface Slot permits CounterSlot, TimeSeriesSlot, ServerCounterSlot, HistogramSlot {

    StatKind kind();

    StatDefinition definition();

    default String statName() {
        return definition().statName();
    }
}
