package com.shardstats.core.stat;

import java.util.Set;

/** Per-stream counters. */
public enum StreamCounter implements CounterStat {
    APPEND_TOTAL("append_total"),
    APPEND_FAILED("append_failed"),
    APPEND_IN_BYTES("append_in_bytes"),
    APPEND_IN_RECORDS("append_in_records"),
    READ_OUT_BYTES("read_out_bytes"),
    READ_OUT_RECORDS("read_out_records");

    private final String statName;

    StreamCounter(String statName) {
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

    @Override
    public StatCategory category() {
        return StatCategory.STREAM;
    }
}
