package com.shardstats.core.registry;

import com.shardstats.core.stat.CounterStat;
import com.shardstats.core.stat.ServerCounter;
import com.shardstats.core.stat.ServerHistogram;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.StatDefinition;
import com.shardstats.core.stat.TimeSeriesStat;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps a runtime stat name to the slot it addresses.
 *
 * <p>The tables are built once from the stat enums and never change afterwards, so a resolver is freely shared
 * between threads. Only the query path resolves names; writers address fields through the enums directly.
 */
public final class NameResolver {

    private static final NameResolver DEFAULT = new NameResolver();

    private final EnumMap<StatKind, Map<String, Slot>> tables = new EnumMap<>(StatKind.class);

    private NameResolver() {
        for (StatKind kind : StatKind.values()) {
            Map<String, Slot> table = new HashMap<>();
            for (StatDefinition definition : kind.definitions()) {
                Slot slot = slotFor(kind, definition);
                for (String alias : definition.aliases()) {
                    Slot previous = table.putIfAbsent(alias, slot);
                    if (previous != null && !previous.equals(slot)) {
                        throw new IllegalStateException("Stat name '" + alias + "' is claimed by both "
                                + previous.definition() + " and " + definition + " in " + kind);
                    }
                }
            }
            tables.put(kind, Collections.unmodifiableMap(table));
        }
    }

    public static NameResolver defaultResolver() {
        return DEFAULT;
    }

    public Optional<Slot> resolve(StatKind kind, String statName) {
        if (kind == null || statName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(kind).get(statName));
    }

    public Optional<CounterSlot> resolveCounter(StatCategory category, String statName) {
        if (category == null) {
            return Optional.empty();
        }
        return resolve(StatKind.counters(category), statName).map(CounterSlot.class::cast);
    }

    public Optional<TimeSeriesSlot> resolveTimeSeries(StatCategory category, String statName) {
        if (category == null) {
            return Optional.empty();
        }
        return resolve(StatKind.timeSeries(category), statName).map(TimeSeriesSlot.class::cast);
    }

    public Optional<ServerCounterSlot> resolveServerCounter(String statName) {
        return resolve(StatKind.SERVER_COUNTER, statName).map(ServerCounterSlot.class::cast);
    }

    public Optional<HistogramSlot> resolveHistogram(String statName) {
        return resolve(StatKind.SERVER_HISTOGRAM, statName).map(HistogramSlot.class::cast);
    }

    /** Every name, aliases included, that resolves for {@code kind}. */
    public Set<String> names(StatKind kind) {
        return Collections.unmodifiableSet(new TreeSet<>(tables.get(kind).keySet()));
    }

    private static Slot slotFor(StatKind kind, StatDefinition definition) {
        return switch (kind) {
            case STREAM_COUNTER, SUBSCRIPTION_COUNTER -> new CounterSlot((CounterStat) definition);
            case STREAM_TIME_SERIES, SUBSCRIPTION_TIME_SERIES -> new TimeSeriesSlot((TimeSeriesStat) definition);
            case SERVER_COUNTER -> new ServerCounterSlot((ServerCounter) definition);
            case SERVER_HISTOGRAM -> new HistogramSlot((ServerHistogram) definition);
        };
    }
}
