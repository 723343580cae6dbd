package com.stockdesk.catalogsync.infrastructure.config;

import com.stockdesk.catalogsync.application.fetch.CatalogFetchProperties;
import com.stockdesk.catalogsync.application.fetch.CatalogFetcher;
import com.stockdesk.catalogsync.application.progress.SyncJobProperties;
import com.stockdesk.catalogsync.application.progress.SyncProgressTracker;
import com.stockdesk.catalogsync.application.queue.RetryQueue;
import com.stockdesk.catalogsync.application.queue.RetryQueueProperties;
import com.stockdesk.catalogsync.application.support.Sleeper;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.MarketplaceApiProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        RetryQueueProperties.class,
        CatalogFetchProperties.class,
        SyncJobProperties.class,
        MarketplaceApiProperties.class
})
public class CatalogSyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    /**
     * Shared outbound queue, all marketplace page requests of all scopes pass through it.
     */
    @Bean(destroyMethod = "close")
    public RetryQueue retryQueue(RetryQueueProperties properties,
                                 Sleeper sleeper,
                                 @Qualifier("retryQueueExecutor") TaskExecutor retryQueueExecutor) {
        return new RetryQueue(properties, sleeper, retryQueueExecutor);
    }

    @Bean
    public CatalogFetcher catalogFetcher(CatalogFetchProperties properties, Sleeper sleeper, RetryQueue retryQueue) {
        return new CatalogFetcher(properties, sleeper, retryQueue);
    }

    @Bean
    public SyncProgressTracker syncProgressTracker(Clock clock) {
        return new SyncProgressTracker(clock);
    }
}
