package com.stockdesk.catalogsync.application.fetch;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits and pacing of the paged catalog fetch
 */
@ConfigurationProperties(prefix = "catalog.fetch")
@Validated
public class CatalogFetchProperties {

    @Min(1)
    private int pageSize = 100;
    @Min(1)
    private int maxIterations = 200;
    @Min(1)
    private int maxConsecutiveErrors = 3;
    @NotNull
    private Duration pageDelay = Duration.ofMillis(300);
    @NotNull
    private Duration rateLimitDelay = Duration.ofSeconds(2);
    @NotNull
    private Duration errorDelay = Duration.ofSeconds(1);
    @Min(1)
    private int bulkReadLimit = 20_000;
    @Min(1)
    private int maxBulkReadLimit = 50_000;
    private boolean dispatchThroughQueue = true;

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    public Duration getPageDelay() {
        return pageDelay;
    }

    public void setPageDelay(Duration pageDelay) {
        this.pageDelay = pageDelay;
    }

    public Duration getRateLimitDelay() {
        return rateLimitDelay;
    }

    public void setRateLimitDelay(Duration rateLimitDelay) {
        this.rateLimitDelay = rateLimitDelay;
    }

    public Duration getErrorDelay() {
        return errorDelay;
    }

    public void setErrorDelay(Duration errorDelay) {
        this.errorDelay = errorDelay;
    }

    public int getBulkReadLimit() {
        return bulkReadLimit;
    }

    public void setBulkReadLimit(int bulkReadLimit) {
        this.bulkReadLimit = bulkReadLimit;
    }

    public int getMaxBulkReadLimit() {
        return maxBulkReadLimit;
    }

    public void setMaxBulkReadLimit(int maxBulkReadLimit) {
        this.maxBulkReadLimit = maxBulkReadLimit;
    }

    public boolean isDispatchThroughQueue() {
        return dispatchThroughQueue;
    }

    public void setDispatchThroughQueue(boolean dispatchThroughQueue) {
        this.dispatchThroughQueue = dispatchThroughQueue;
    }
}
