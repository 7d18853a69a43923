package com.fintracker.config;

import com.fintracker.infrastructure.persistence.queue.WriteQueue;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

@Configuration
public class WriteQueueConfiguration {

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public MeterBinder retryMetrics(RetryRegistry retryRegistry) {
        return TaggedRetryMetrics.ofRetryRegistry(retryRegistry);
    }

    /**
     * The single write queue of the process; every repository write goes through it.
     * Closed before the data source so pending writes can drain.
     */
    @Bean(destroyMethod = "close")
    @DependsOn("dataSource")
    public WriteQueue writeQueue(AppProperties properties, RetryRegistry retryRegistry, MeterRegistry meterRegistry) {
        return new WriteQueue(properties.getWriteQueue(), retryRegistry, meterRegistry);
    }
}
