package com.shardstats.core.stat;

import java.util.Set;

/** Per-subscription counters. */
public enum SubscriptionCounter implements CounterStat {
    SEND_OUT_BYTES("send_out_bytes"),
    SEND_OUT_RECORDS("send_out_records"),
    SEND_OUT_RECORDS_FAILED("send_out_records_failed"),
    RESEND_RECORDS("resend_records"),
    RESEND_RECORDS_FAILED("resend_records_failed"),
    RECEIVED_ACKS("received_acks"),
    REQUEST_MESSAGES("request_messages"),
    RESPONSE_MESSAGES("response_messages");

    private final String statName;

    SubscriptionCounter(String statName) {
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
        return StatCategory.SUBSCRIPTION;
    }
}
