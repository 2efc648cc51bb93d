package com.shardstats.core.stat;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/** Per-subscription rate series. */
public enum SubscriptionTimeSeries implements TimeSeriesStat {
    SEND_OUT_BYTES("send_out_bytes", "sends"),
    ACKS("acks", "ackes"),
    REQUEST_MESSAGES("request_messages", "requests"),
    RESPONSE_MESSAGES("response_messages", "responses");

    private final String statName;
    private final Set<String> aliases;

    SubscriptionTimeSeries(String statName, String... shortNames) {
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
        return StatCategory.SUBSCRIPTION;
    }

    @Override
    public List<Duration> intervals() {
        return DEFAULT_INTERVALS;
    }
}
