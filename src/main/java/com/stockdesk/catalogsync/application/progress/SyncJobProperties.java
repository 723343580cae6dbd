package com.stockdesk.catalogsync.application.progress;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Lifetime of sync jobs held by the progress tracker, and the nightly sync schedule
 */
@ConfigurationProperties(prefix = "catalog.sync")
public class SyncJobProperties {

    private Duration stuckTimeout = Duration.ofMinutes(30);
    private Duration finishedRetention = Duration.ofMinutes(5);
    private Duration guardInterval = Duration.ofSeconds(60);
    private boolean guardEnabled = true;
    private String cron = "0 0 3 * * *";
    private boolean scheduledEnabled = true;

    public Duration getStuckTimeout() {
        return stuckTimeout;
    }

    public void setStuckTimeout(Duration stuckTimeout) {
        this.stuckTimeout = stuckTimeout;
    }

    public Duration getFinishedRetention() {
        return finishedRetention;
    }

    public void setFinishedRetention(Duration finishedRetention) {
        this.finishedRetention = finishedRetention;
    }

    public Duration getGuardInterval() {
        return guardInterval;
    }

    public void setGuardInterval(Duration guardInterval) {
        this.guardInterval = guardInterval;
    }

    public boolean isGuardEnabled() {
        return guardEnabled;
    }

    public void setGuardEnabled(boolean guardEnabled) {
        this.guardEnabled = guardEnabled;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public boolean isScheduledEnabled() {
        return scheduledEnabled;
    }

    public void setScheduledEnabled(boolean scheduledEnabled) {
        this.scheduledEnabled = scheduledEnabled;
    }
}
