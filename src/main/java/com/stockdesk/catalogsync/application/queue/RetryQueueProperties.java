package com.stockdesk.catalogsync.application.queue;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the outbound retry queue
 */
@ConfigurationProperties(prefix = "catalog.queue")
@Validated
public class RetryQueueProperties {

    @Min(1)
    private int concurrency = 5;
    @NotNull
    private Duration batchDelay = Duration.ofMillis(200);
    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(1);
    @Min(0)
    private int defaultMaxRetries = 3;

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    public void setBatchDelay(Duration batchDelay) {
        this.batchDelay = batchDelay;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }
}
