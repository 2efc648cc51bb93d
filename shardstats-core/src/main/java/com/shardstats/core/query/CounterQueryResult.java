package com.shardstats.core.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-key counter totals as two parallel lists of equal length.
 */
public record CounterQueryResult(QueryStatus status, List<String> keys, List<Long> values) {

    public CounterQueryResult {
        keys = List.copyOf(keys);
        values = List.copyOf(values);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("keys and values differ in length");
        }
    }

    public static CounterQueryResult of(Map<String, Long> totals) {
        return new CounterQueryResult(
                QueryStatus.OK, new ArrayList<>(totals.keySet()), new ArrayList<>(totals.values()));
    }

    public static CounterQueryResult failed(QueryStatus status) {
        return new CounterQueryResult(status, List.of(), List.of());
    }

    public Map<String, Long> asMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            map.put(keys.get(i), values.get(i));
        }
        return map;
    }
}
