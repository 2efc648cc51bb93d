package com.shardstats.core.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.shardstats.core.config.IntervalPolicy;
import com.shardstats.core.config.StatsParams;
import com.shardstats.core.query.CounterQueryResult;
import com.shardstats.core.query.PercentilesQueryResult;
import com.shardstats.core.query.QueryStatus;
import com.shardstats.core.query.ScalarQueryResult;
import com.shardstats.core.query.TimeSeriesBulkQueryResult;
import com.shardstats.core.query.TimeSeriesQueryResult;
import com.shardstats.core.stat.ServerCounter;
import com.shardstats.core.stat.ServerHistogram;
import com.shardstats.core.stat.StatCategory;
import com.shardstats.core.stat.StreamCounter;
import com.shardstats.core.stat.StreamTimeSeries;
import com.shardstats.core.stat.SubscriptionTimeSeries;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatsAggregatorTest {

    private static final List<Duration> TEN_SECONDS = List.of(Duration.ofSeconds(10));

    private Clock clock;
    private StatsAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(100_000L);
        aggregator = new StatsAggregator(StatsParams.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        aggregator.close();
    }

    @Test
    void countersAreSummedAcrossThreads() throws Exception {
        runOnThread(() -> aggregator.add(StreamCounter.APPEND_IN_BYTES, "stream1", 100));
        runOnThread(() -> aggregator.add(StreamCounter.APPEND_IN_BYTES, "stream1", 50));

        CounterQueryResult result = aggregator.getAllCounters(StatCategory.STREAM, "append_in_bytes");

        assertThat(result.status()).isEqualTo(QueryStatus.OK);
        assertThat(result.asMap()).containsExactly(Map.entry("stream1", 150L));
    }

    @Test
    void keysMissingOnSomeShardsCountAsZeroThere() throws Exception {
        CountDownLatch written = new CountDownLatch(2);
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            pool.submit(() -> {
                aggregator.add(StreamCounter.READ_OUT_RECORDS, "b", 2);
                written.countDown();
                await(done);
            });
            pool.submit(() -> {
                aggregator.add(StreamCounter.READ_OUT_RECORDS, "a", 1);
                aggregator.add(StreamCounter.READ_OUT_RECORDS, "b", 3);
                written.countDown();
                await(done);
            });
            written.await(5, TimeUnit.SECONDS);

            assertThat(aggregator.shardCount()).isEqualTo(2);
            CounterQueryResult result = aggregator.getAllCounters(StatCategory.STREAM, "read_out_records");
            assertThat(result.keys()).containsExactly("a", "b");
            assertThat(result.values()).containsExactly(1L, 5L);
        } finally {
            done.countDown();
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void crossThreadRateEqualsSumOfPerThreadRates() throws Exception {
        when(clock.millis()).thenReturn(95_000L);
        runOnThread(() -> aggregator.record(StreamTimeSeries.APPEND_IN_BYTES, "orders", 300));
        when(clock.millis()).thenReturn(99_000L);
        runOnThread(() -> aggregator.record(StreamTimeSeries.APPEND_IN_BYTES, "orders", 200));
        when(clock.millis()).thenReturn(100_000L);

        TimeSeriesQueryResult result = aggregator.getTimeSeries(
                StatCategory.STREAM, "appends", "orders", List.of(Duration.ofSeconds(2), Duration.ofSeconds(10)));

        assertThat(result.status()).isEqualTo(QueryStatus.OK);
        assertThat(result.rates()).containsExactly(100.0, 50.0);
    }

    @Test
    void unknownKeyHasZeroRates() {
        TimeSeriesQueryResult result =
                aggregator.getTimeSeries(StatCategory.SUBSCRIPTION, "acks", "nobody", TEN_SECONDS);

        assertThat(result.status()).isEqualTo(QueryStatus.OK);
        assertThat(result.rates()).containsExactly(0.0);
    }

    @Test
    void bulkTimeSeriesCoversEveryKey() {
        aggregator.record(SubscriptionTimeSeries.SEND_OUT_BYTES, "sub-b", 20);
        aggregator.record(SubscriptionTimeSeries.SEND_OUT_BYTES, "sub-a", 10);

        TimeSeriesBulkQueryResult result =
                aggregator.getAllTimeSeries(StatCategory.SUBSCRIPTION, "sends", TEN_SECONDS);

        assertThat(result.status()).isEqualTo(QueryStatus.OK);
        assertThat(result.keys()).containsExactly("sub-a", "sub-b");
        assertThat(result.asMap()).containsEntry("sub-a", List.of(1.0)).containsEntry("sub-b", List.of(2.0));
    }

    @Test
    void unknownNamesReportNotFoundWithEmptyOutput() {
        CounterQueryResult counters = aggregator.getAllCounters(StatCategory.STREAM, "does_not_exist");
        TimeSeriesQueryResult series =
                aggregator.getTimeSeries(StatCategory.STREAM, "does_not_exist", "orders", TEN_SECONDS);
        TimeSeriesBulkQueryResult bulk =
                aggregator.getAllTimeSeries(StatCategory.STREAM, "does_not_exist", TEN_SECONDS);

        assertThat(counters.status()).isEqualTo(QueryStatus.NOT_FOUND);
        assertThat(counters.keys()).isEmpty();
        assertThat(counters.values()).isEmpty();
        assertThat(series.status()).isEqualTo(QueryStatus.NOT_FOUND);
        assertThat(series.rates()).isEmpty();
        assertThat(bulk.status()).isEqualTo(QueryStatus.NOT_FOUND);
        assertThat(bulk.keys()).isEmpty();
        assertThat(aggregator.getCounter("does_not_exist").status()).isEqualTo(QueryStatus.NOT_FOUND);
        assertThat(aggregator.histogramAdd("does_not_exist", 1)).isEqualTo(QueryStatus.NOT_FOUND);
        assertThat(aggregator.histogramEstimatePercentile("does_not_exist", 0.5)).isEqualTo(-1);
        assertThat(aggregator.histogramEstimatePercentiles("does_not_exist", List.of(0.5)).status())
                .isEqualTo(QueryStatus.NOT_FOUND);
    }

    @Test
    void invalidIntervalsAreReported() {
        TimeSeriesQueryResult result =
                aggregator.getTimeSeries(StatCategory.STREAM, "reads", "orders", List.of(Duration.ZERO));

        assertThat(result.status()).isEqualTo(QueryStatus.INVALID_INTERVAL);
        assertThat(result.rates()).isEmpty();
    }

    @Test
    void uncheckedPolicyAnswersLongIntervals() {
        aggregator.record(StreamTimeSeries.READ_OUT_BYTES, "orders", 3_600);

        TimeSeriesQueryResult result =
                aggregator.getTimeSeries(StatCategory.STREAM, "reads", "orders", List.of(Duration.ofHours(1)));

        assertThat(result.status()).isEqualTo(QueryStatus.OK);
        assertThat(result.rates()).containsExactly(1.0);
    }

    @Test
    void rejectPolicyRefusesIntervalsPastTheKeyMaximum() {
        StatsParams params = StatsParams.builder()
                .intervalPolicy(IntervalPolicy.REJECT)
                .maxStreamStatsInterval(Duration.ofMinutes(1))
                .streamIntervalOverride("audit", Duration.ofMinutes(30))
                .build();
        try (StatsAggregator strict = new StatsAggregator(params, clock)) {
            strict.record(StreamTimeSeries.READ_OUT_BYTES, "orders", 1);
            strict.record(StreamTimeSeries.READ_OUT_BYTES, "audit", 1);
            List<Duration> fiveMinutes = List.of(Duration.ofMinutes(5));

            assertThat(strict.getTimeSeries(StatCategory.STREAM, "reads", "orders", fiveMinutes).status())
                    .isEqualTo(QueryStatus.INTERVAL_TOO_LARGE);
            assertThat(strict.getTimeSeries(StatCategory.STREAM, "reads", "audit", fiveMinutes).status())
                    .isEqualTo(QueryStatus.OK);
            assertThat(strict.getAllTimeSeries(StatCategory.STREAM, "reads", fiveMinutes).status())
                    .isEqualTo(QueryStatus.INTERVAL_TOO_LARGE);
        }
    }

    @Test
    void serverCounterTotalsAcrossThreads() throws Exception {
        runOnThread(() -> aggregator.add(ServerCounter.SUBSCRIPTION_REQUESTS, 2));
        aggregator.add(ServerCounter.SUBSCRIPTION_REQUESTS, 5);

        assertThat(aggregator.getCounter("subscription_requests").value()).isEqualTo(7);
    }

    @Test
    void histogramsMergeAcrossThreads() throws Exception {
        runOnThread(() -> aggregator.histogramAdd("append_latency", 100));
        runOnThread(() -> aggregator.addLatency(ServerHistogram.APPEND_LATENCY, 200));
        assertThat(aggregator.histogramAdd("append_latency", 300)).isEqualTo(QueryStatus.OK);

        PercentilesQueryResult result = aggregator.histogramEstimatePercentiles("append_latency", List.of(0.5, 1.0));

        assertThat(result.status()).isEqualTo(QueryStatus.OK);
        assertThat(result.count()).isEqualTo(3);
        assertThat(result.sum()).isEqualTo(600);
        assertThat(result.estimates()).containsExactly(225L, 300L);
        assertThat(aggregator.histogramEstimatePercentile("append_latency", 0.5)).isEqualTo(225);
    }

    @Test
    void emptyHistogramEstimatesZero() {
        assertThat(aggregator.histogramEstimatePercentile("read_latency", 0.99)).isZero();
    }

    @Test
    void clientAggregatorHasNoHistograms() {
        try (StatsAggregator client = new StatsAggregator(StatsParams.forServer(false), clock)) {
            assertThat(client.histogramAdd("append_latency", 100)).isEqualTo(QueryStatus.NOT_FOUND);
            assertThat(client.histogramEstimatePercentile("append_latency", 0.5)).isEqualTo(-1);
            assertThat(client.histogramEstimatePercentiles("append_latency", List.of(0.5)).estimates())
                    .isEmpty();
        }
    }

    @Test
    void exitedThreadsKeepContributing() throws Exception {
        runOnThread(() -> {
            aggregator.add(StreamCounter.APPEND_TOTAL, "orders", 4);
            aggregator.deregister();
        });

        assertThat(aggregator.shardCount()).isZero();
        assertThat(aggregator.getAllCounters(StatCategory.STREAM, "append_total").asMap())
                .containsEntry("orders", 4L);
    }

    @Test
    void registerIsIdempotentPerThread() {
        assertThat(aggregator.register()).isSameAs(aggregator.shard());
        assertThat(aggregator.shardCount()).isEqualTo(1);
    }

    @Test
    void resetZeroesLiveAndRetiredShards() throws Exception {
        runOnThread(() -> {
            aggregator.add(StreamCounter.APPEND_TOTAL, "orders", 4);
            aggregator.deregister();
        });
        aggregator.add(StreamCounter.APPEND_TOTAL, "orders", 1);

        aggregator.reset();

        assertThat(aggregator.getAllCounters(StatCategory.STREAM, "append_total").asMap())
                .containsEntry("orders", 0L);
    }

    @Test
    void closedAggregatorRefusesWork() {
        aggregator.close();

        assertThatThrownBy(() -> aggregator.getCounter("read_requests")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(aggregator::register).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void writesAfterCloseAreDroppedOnEveryThread() throws Exception {
        aggregator.add(StreamCounter.APPEND_TOTAL, "orders", 1);
        aggregator.close();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Runnable writes = () -> {
            try {
                aggregator.add(StreamCounter.APPEND_TOTAL, "orders", 1);
                aggregator.record(StreamTimeSeries.APPEND_IN_BYTES, "orders", 1);
                aggregator.add(ServerCounter.APPEND_REQUESTS, 1);
                aggregator.addLatency(ServerHistogram.APPEND_LATENCY, 10);
                assertThat(aggregator.histogramAdd("append_latency", 10)).isEqualTo(QueryStatus.OK);
            } catch (Throwable e) {
                failure.set(e);
            }
        };
        writes.run();
        runOnThread(writes);

        assertThat(failure.get()).isNull();
        assertThat(aggregator.isClosed()).isTrue();
        assertThat(aggregator.shardCount()).isZero();
        // the stale shard of this thread is gone too
        assertThatThrownBy(aggregator::shard).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void counterForOneKeyIsSummedAcrossThreads() throws Exception {
        runOnThread(() -> aggregator.add(StreamCounter.APPEND_IN_BYTES, "stream1", 100));
        runOnThread(() -> aggregator.add(StreamCounter.APPEND_IN_BYTES, "stream1", 50));
        aggregator.add(StreamCounter.APPEND_IN_BYTES, "stream2", 7);

        ScalarQueryResult stream1 = aggregator.getCounter(StatCategory.STREAM, "append_in_bytes", "stream1");
        ScalarQueryResult unseen = aggregator.getCounter(StatCategory.STREAM, "append_in_bytes", "stream9");

        assertThat(stream1.status()).isEqualTo(QueryStatus.OK);
        assertThat(stream1.value()).isEqualTo(150);
        assertThat(unseen.status()).isEqualTo(QueryStatus.OK);
        assertThat(unseen.value()).isZero();
        assertThat(aggregator.getCounter(StatCategory.STREAM, "does_not_exist", "stream1").status())
                .isEqualTo(QueryStatus.NOT_FOUND);
    }

    @Test
    void reductionsStayConsistentWhileKeysAreAdded() throws Exception {
        int keyCount = 5_000;
        CountDownLatch started = new CountDownLatch(1);
        Thread writer = new Thread(() -> {
            started.countDown();
            for (int i = 0; i < keyCount; i++) {
                String key = String.format("key-%05d", i);
                aggregator.add(StreamCounter.APPEND_TOTAL, key, 1);
                aggregator.record(StreamTimeSeries.APPEND_IN_BYTES, key, 1);
            }
        });
        writer.start();
        started.await();

        int previousKeys = 0;
        while (writer.isAlive()) {
            CounterQueryResult counters = aggregator.getAllCounters(StatCategory.STREAM, "append_total");
            TimeSeriesBulkQueryResult series =
                    aggregator.getAllTimeSeries(StatCategory.STREAM, "appends", TEN_SECONDS);

            assertThat(counters.status()).isEqualTo(QueryStatus.OK);
            assertThat(counters.values()).hasSameSizeAs(counters.keys());
            // a block can be visible before its first add lands
            assertThat(counters.values()).allSatisfy(value -> assertThat(value).isBetween(0L, 1L));
            assertThat(counters.keys().size()).isGreaterThanOrEqualTo(previousKeys);
            previousKeys = counters.keys().size();
            assertThat(series.status()).isEqualTo(QueryStatus.OK);
            assertThat(series.rates()).hasSameSizeAs(series.keys());
        }
        writer.join();

        CounterQueryResult counters = aggregator.getAllCounters(StatCategory.STREAM, "append_total");
        assertThat(counters.keys()).hasSize(keyCount);
        assertThat(counters.values()).containsOnly(1L);
        assertThat(aggregator.getAllTimeSeries(StatCategory.STREAM, "appends", TEN_SECONDS).keys())
                .hasSize(keyCount);
    }

    @Test
    void constructorValidatesParams() {
        StatsParams invalid = StatsParams.builder().maxSubscriptionStatsInterval(Duration.ZERO).build();

        assertThatThrownBy(() -> new StatsAggregator(invalid, clock)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void runOnThread(Runnable work) throws InterruptedException {
        Thread thread = new Thread(work);
        thread.start();
        thread.join();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
