package com.gt.lse.conf;

import com.gt.lse.util.DurableStoreRetry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class BeanConfig {

    public static final String SESSION_FLUSH_EXECUTOR = "sessionFlushExecutor";
    public static final String ANALYTICS_EXECUTOR = "analyticsExecutor";

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean("durableStoreRetry")
    public DurableStoreRetry getDurableStoreRetry(@Value("${lse.store.retry.maxAttempts:4}") int maxAttempts,
                                                  @Value("${lse.store.retry.initialBackoffMs:100}") long initialBackoffMs,
                                                  @Value("${lse.store.retry.backoffMultiplier:2.0}") double backoffMultiplier) {
        return new DurableStoreRetry("durable-store", maxAttempts, Duration.ofMillis(initialBackoffMs), backoffMultiplier);
    }

    @Bean(SESSION_FLUSH_EXECUTOR)
    public ThreadPoolTaskExecutor getSessionFlushExecutor(@Value("${lse.session.flushThreads:4}") int flushThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(flushThreads);
        executor.setMaxPoolSize(flushThreads);
        executor.setThreadNamePrefix("session-flush-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    // Bounded queue. Publishes beyond capacity are rejected and dropped by AnalyticsPublisher.
    @Bean(ANALYTICS_EXECUTOR)
    public ThreadPoolTaskExecutor getAnalyticsExecutor(@Value("${lse.analytics.threads:2}") int analyticsThreads,
                                                       @Value("${lse.analytics.queueCapacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analyticsThreads);
        executor.setMaxPoolSize(analyticsThreads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analytics-");
        return executor;
    }
}
