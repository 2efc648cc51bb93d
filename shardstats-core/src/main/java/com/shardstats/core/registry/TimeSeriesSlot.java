package com.shardstats.core.registry;

import com.shardstats.core.shard.PerKeyStatsBlock;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.TimeSeriesStat;
import com.shardstats.core.timeseries.TimeSeries;

public record TimeSeriesSlot(TimeSeriesStat definition) implements Slot {

    @Override
    public StatKind kind() {
        return StatKind.timeSeries(definition.category());
    }

    public StatCategory category() {
        return definition.category();
    }

    public TimeSeries series(PerKeyStatsBlock block) {
        return block.timeSeries(definition);
    }
}
