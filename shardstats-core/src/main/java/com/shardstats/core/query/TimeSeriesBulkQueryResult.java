package com.shardstats.core.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-thread rate vectors for every key seen on any shard, as two parallel lists.
 */
public record TimeSeriesBulkQueryResult(QueryStatus status, List<String> keys, List<List<Double>> rates) {

    public TimeSeriesBulkQueryResult {
        keys = List.copyOf(keys);
        rates = rates.stream().map(List::copyOf).toList();
        if (keys.size() != rates.size()) {
            throw new IllegalArgumentException("keys and rates differ in length");
        }
    }

    public static TimeSeriesBulkQueryResult of(Map<String, List<Double>> ratesByKey) {
        return new TimeSeriesBulkQueryResult(
                QueryStatus.OK, new ArrayList<>(ratesByKey.keySet()), new ArrayList<>(ratesByKey.values()));
    }

    public static TimeSeriesBulkQueryResult failed(QueryStatus status) {
        return new TimeSeriesBulkQueryResult(status, List.of(), List.of());
    }

    public Map<String, List<Double>> asMap() {
        Map<String, List<Double>> map = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            map.put(keys.get(i), rates.get(i));
        }
        return map;
    }
}
