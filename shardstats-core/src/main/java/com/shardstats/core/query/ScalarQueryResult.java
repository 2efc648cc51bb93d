package com.shardstats.core.query;

public record ScalarQueryResult(QueryStatus status, long value) {

    public static ScalarQueryResult of(long value) {
        return new ScalarQueryResult(QueryStatus.OK, value);
    }

    public static ScalarQueryResult failed(QueryStatus status) {
        return new ScalarQueryResult(status, 0);
    }
}
