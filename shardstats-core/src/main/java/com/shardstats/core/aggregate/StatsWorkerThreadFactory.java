package com.shardstats.core.aggregate;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory tying a worker's stats shard to its lifetime: the shard is registered before the worker runs its
 * task and deregistered when the task returns or throws. Workers started after the aggregator closed run without a
 * shard.
 */
public final class StatsWorkerThreadFactory implements ThreadFactory {

    private final StatsAggregator aggregator;
    private final String namePrefix;
    private final boolean daemon;
    private final AtomicInteger sequence = new AtomicInteger();

    public StatsWorkerThreadFactory(StatsAggregator aggregator, String namePrefix) {
        this(aggregator, namePrefix, true);
    }

    public StatsWorkerThreadFactory(StatsAggregator aggregator, String namePrefix, boolean daemon) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(
                () -> {
                    aggregator.tryRegister();
                    try {
                        task.run();
                    } finally {
                        aggregator.deregister();
                    }
                },
                namePrefix + sequence.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }
}
