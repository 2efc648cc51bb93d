package com.shardstats.core.stat;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/** A per-key time-series field of a {@link StatCategory} block. */
public interface TimeSeriesStat extends StatDefinition {

    /** Intervals the series is reported over by default. */
    List<Duration> DEFAULT_INTERVALS =
            List.of(Duration.ofSeconds(10), Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(600));

    StatCategory category();

    List<Duration> intervals();

    default Duration maxInterval() {
        return Collections.max(intervals());
    }
}
