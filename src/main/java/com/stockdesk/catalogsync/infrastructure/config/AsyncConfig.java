package com.stockdesk.catalogsync.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for sync runs and outbound marketplace calls
 */
@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${catalog.executor.sync-pool-size:4}")
    private int syncPoolSize;

    @Value("${catalog.executor.sync-queue-capacity:16}")
    private int syncQueueCapacity;

    @Value("${catalog.executor.marketplace-pool-size:8}")
    private int marketplacePoolSize;

    /**
     * Long-running sync runs. Full queue rejects new runs instead of running them on the caller.
     * Running syncs are interrupted on shutdown and end as cancelled.
     */
    @Bean("syncExecutor")
    public TaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncPoolSize);
        executor.setMaxPoolSize(syncPoolSize);
        executor.setQueueCapacity(syncQueueCapacity);
        executor.setThreadNamePrefix("catalog-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        logger.info("Initialized sync executor: pool={}, queue={}", syncPoolSize, syncQueueCapacity);
        return executor;
    }

    /**
     * Blocking Retrofit calls to the marketplaces.
     */
    @Bean("marketplaceExecutor")
    public TaskExecutor marketplaceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(marketplacePoolSize);
        executor.setMaxPoolSize(marketplacePoolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("marketplace-http-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();

        logger.info("Initialized marketplace executor: pool={}", marketplacePoolSize);
        return executor;
    }

    /**
     * Single drain thread of the retry queue. The queue starts at most one drain at a time.
     */
    @Bean("retryQueueExecutor")
    public TaskExecutor retryQueueExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.setThreadNamePrefix("retry-queue-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        logger.info("Initialized retry queue executor");
        return executor;
    }
}
