package com.shardstats.core.stat;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/** Per-stream rate series. Short and long forms of a name resolve to the same series. */
public enum StreamTimeSeries implements TimeSeriesStat {
    APPEND_IN_BYTES("append_in_bytes", "appends"),
    APPEND_IN_RECORDS("append_in_records"),
    APPEND_IN_REQUESTS("append_in_requests", "append_requests"),
    APPEND_FAILED_REQUESTS("append_failed_requests", "append_failed"),
    READ_OUT_BYTES("read_out_bytes", "reads");

    private final String statName;
    private final Set<String> aliases;

    StreamTimeSeries(String statName, String... shortNames) {
        this.statName = statName;
        this.aliases = StatNames.aliases(statName, shortNames);
    }

    @Override
    public String statName() {
        return statName;
    }

    @Override
    public Set<String> aliases() {
        return aliases;
    }

    @Override
    public StatCategory category() {
        return StatCategory.STREAM;
    }

    @Override
    public List<Duration> intervals() {
        return DEFAULT_INTERVALS;
    }
}
