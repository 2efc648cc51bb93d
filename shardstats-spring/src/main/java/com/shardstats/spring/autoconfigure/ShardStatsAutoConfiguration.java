package com.shardstats.spring.autoconfigure;

import com.shardstats.core.aggregate.StatsAggregator;
import com.shardstats.core.config.StatsParams;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(ShardStatsProperties.class)
@ConditionalOnProperty(prefix = "shardstats", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ShardStatsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock shardStatsClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(StatsParams.class)
    public StatsParams statsParams(ShardStatsProperties properties) {
        return properties.toStatsParams();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(StatsAggregator.class)
    public StatsAggregator statsAggregator(StatsParams statsParams, Clock clock) {
        return new StatsAggregator(statsParams, clock);
    }
}
