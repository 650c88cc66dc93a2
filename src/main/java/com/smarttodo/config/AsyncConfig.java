package com.smarttodo.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Background job execution for enrichment work.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ENRICHMENT_EXECUTOR = "enrichmentExecutor";

    @Value("${smarttodo.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${smarttodo.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${smarttodo.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean(ENRICHMENT_EXECUTOR)
    public Executor enrichmentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("enrich-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
