package com.shardstats.core.stat;

/** A per-key counter field of a {@link StatCategory} block. */
public interface CounterStat extends StatDefinition {

    StatCategory category();
}
