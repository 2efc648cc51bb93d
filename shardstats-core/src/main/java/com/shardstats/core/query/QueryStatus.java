package com.shardstats.core.query;

/**
 * Outcome of a stats query. Anything but {@link #OK} comes with empty output.
 */
public enum QueryStatus {
    OK,
    /** The stat name does not resolve to any slot of the addressed kind, or the slot is absent on this aggregator. */
    NOT_FOUND,
    /** A requested interval exceeds the key's maximum under {@code IntervalPolicy.REJECT}. */
    INTERVAL_TOO_LARGE,
    /** A requested interval is missing or shorter than one millisecond. */
    INVALID_INTERVAL;

    public boolean isOk() {
        return this == OK;
    }
}
