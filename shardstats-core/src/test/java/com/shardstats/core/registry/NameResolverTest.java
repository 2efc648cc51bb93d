package com.shardstats.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.shardstats.core.stat.ServerCounter;
import com.shardstats.core.stat.ServerHistogram;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.StreamCounter;
import com.shardstats.core.stat.StreamTimeSeries;
import com.shardstats.core.stat.SubscriptionTimeSeries;
import org.junit.jupiter.api.Test;

class NameResolverTest {

    private final NameResolver resolver = NameResolver.defaultResolver();

    @Test
    void resolvesCanonicalNames() {
        assertThat(resolver.resolveCounter(StatCategory.STREAM, "append_in_bytes"))
                .map(CounterSlot::definition)
                .contains(StreamCounter.APPEND_IN_BYTES);
        assertThat(resolver.resolveServerCounter("read_requests"))
                .map(ServerCounterSlot::definition)
                .contains(ServerCounter.READ_REQUESTS);
        assertThat(resolver.resolveHistogram("append_latency"))
                .map(HistogramSlot::definition)
                .contains(ServerHistogram.APPEND_LATENCY);
    }

    @Test
    void aliasesResolveToSameSlot() {
        assertThat(resolver.resolveTimeSeries(StatCategory.STREAM, "appends"))
                .isEqualTo(resolver.resolveTimeSeries(StatCategory.STREAM, "append_in_bytes"))
                .map(TimeSeriesSlot::definition)
                .contains(StreamTimeSeries.APPEND_IN_BYTES);
        assertThat(resolver.resolveTimeSeries(StatCategory.SUBSCRIPTION, "ackes"))
                .map(TimeSeriesSlot::definition)
                .contains(SubscriptionTimeSeries.ACKS);
        assertThat(resolver.resolveTimeSeries(StatCategory.SUBSCRIPTION, "sends"))
                .map(TimeSeriesSlot::definition)
                .contains(SubscriptionTimeSeries.SEND_OUT_BYTES);
    }

    @Test
    void namesAreScopedToTheirKind() {
        // a stream time-series alias is not a stream counter
        assertThat(resolver.resolveCounter(StatCategory.STREAM, "appends")).isEmpty();
        assertThat(resolver.resolveCounter(StatCategory.SUBSCRIPTION, "append_in_bytes")).isEmpty();
        assertThat(resolver.resolveServerCounter("append_requests")).isPresent();
        assertThat(resolver.resolveTimeSeries(StatCategory.STREAM, "append_requests"))
                .map(TimeSeriesSlot::definition)
                .contains(StreamTimeSeries.APPEND_IN_REQUESTS);
    }

    @Test
    void unknownNamesResolveToEmpty() {
        assertThat(resolver.resolveCounter(StatCategory.STREAM, "does_not_exist")).isEmpty();
        assertThat(resolver.resolveCounter(StatCategory.STREAM, null)).isEmpty();
        assertThat(resolver.resolveCounter(null, "append_total")).isEmpty();
        assertThat(resolver.resolveHistogram("")).isEmpty();
    }

    @Test
    void namesListsAliases() {
        assertThat(resolver.names(StatKind.STREAM_TIME_SERIES))
                .contains("append_in_bytes", "appends", "reads", "append_failed");
    }
}
