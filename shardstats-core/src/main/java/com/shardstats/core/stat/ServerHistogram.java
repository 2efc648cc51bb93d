package com.shardstats.core.stat;

import java.util.Set;

/** Server-wide latency histograms, in microseconds. Only present on server aggregators. */
public enum ServerHistogram implements StatDefinition {
    APPEND_REQUEST_LATENCY("append_request_latency"),
    APPEND_LATENCY("append_latency"),
    READ_LATENCY("read_latency"),
    SUBSCRIPTION_ACK_LATENCY("subscription_ack_latency");

    private final String statName;

    ServerHistogram(String statName) {
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
