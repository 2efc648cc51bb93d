package com.shardstats.core.config;

/**
 * What a rate query does with an interval longer than the key's configured maximum.
 */
public enum IntervalPolicy {
    /** Answer anyway; buckets older than the retained history simply do not contribute. */
    UNCHECKED,
    /** Refuse the query with {@code INTERVAL_TOO_LARGE}. */
    REJECT
}
