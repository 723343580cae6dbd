package com.stockdesk.catalogsync.application.progress;

import com.stockdesk.catalogsync.domain.exception.SyncAlreadyRunningException;
import com.stockdesk.catalogsync.domain.exception.SyncJobStateException;
import com.stockdesk.catalogsync.domain.model.SyncJob;
import com.stockdesk.catalogsync.domain.model.SyncProgress;
import com.stockdesk.catalogsync.domain.model.SyncResult;
import com.stockdesk.catalogsync.domain.model.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * In-memory state of the latest sync job per scope, safe to poll while a run updates it.
 *
 * <p>A scope has at most one processing job. Status only moves forward
 * ({@code PROCESSING -> COMPLETED | ERROR}); a later {@link #start(String)} replaces a finished job.
 */
public class SyncProgressTracker {

    private static final Logger logger = LoggerFactory.getLogger(SyncProgressTracker.class);

    private final Clock clock;
    private final Map<String, JobState> jobs = new HashMap<>();

    public SyncProgressTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws SyncAlreadyRunningException if the scope already has a processing job
     */
    public synchronized SyncJob start(String scopeKey) {
        JobState existing = jobs.get(scopeKey);
        if (existing != null && existing.status == SyncStatus.PROCESSING) {
            throw new SyncAlreadyRunningException(scopeKey);
        }

        Instant now = clock.instant();
        JobState state = new JobState(scopeKey, now);
        jobs.put(scopeKey, state);
        logger.info("Sync job started for scope {}", scopeKey);
        return state.snapshot();
    }

    /**
     * Record progress of a running job. {@code current} never goes backwards.
     *
     * @return false if the scope has no processing job, in which case nothing changes
     */
    public synchronized boolean update(String scopeKey, SyncProgress progress) {
        JobState state = jobs.get(scopeKey);
        if (state == null || state.status != SyncStatus.PROCESSING) {
            logger.debug("Ignoring progress for scope {} without a running job", scopeKey);
            return false;
        }
        state.progress = progress.withCurrentAtLeast(state.progress.current());
        state.updatedAt = clock.instant();
        return true;
    }

    public synchronized SyncJob complete(String scopeKey, SyncResult result) {
        JobState state = requireProcessing(scopeKey, "complete");
        state.status = SyncStatus.COMPLETED;
        state.result = result;
        state.finish(clock.instant());
        logger.info("Sync job completed for scope {}: {} items", scopeKey, result.syncedCount());
        return state.snapshot();
    }

    public synchronized SyncJob fail(String scopeKey, String error) {
        JobState state = requireProcessing(scopeKey, "fail");
        state.status = SyncStatus.ERROR;
        state.error = error;
        state.finish(clock.instant());
        logger.warn("Sync job failed for scope {}: {}", scopeKey, error);
        return state.snapshot();
    }

    /**
     * @return the scope's job, or an {@code IDLE} snapshot if there is none
     */
    public synchronized SyncJob get(String scopeKey) {
        JobState state = jobs.get(scopeKey);
        return state != null ? state.snapshot() : SyncJob.idle(scopeKey);
    }

    /**
     * Processing jobs that have not reported progress for longer than {@code timeout}.
     */
    public synchronized List<SyncJob> findStalled(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<SyncJob> stalled = new ArrayList<>();
        for (JobState state : jobs.values()) {
            if (state.status == SyncStatus.PROCESSING && state.updatedAt.isBefore(cutoff)) {
                stalled.add(state.snapshot());
            }
        }
        return stalled;
    }

    /**
     * Forget finished jobs older than {@code retention}; their scopes read as idle afterwards.
     *
     * @return number of jobs removed
     */
    public synchronized int evictFinished(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        Iterator<JobState> iterator = jobs.values().iterator();
        while (iterator.hasNext()) {
            JobState state = iterator.next();
            if (state.status.isTerminal() && state.finishedAt.isBefore(cutoff)) {
                iterator.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.debug("Evicted {} finished sync job(s)", evicted);
        }
        return evicted;
    }

    private JobState requireProcessing(String scopeKey, String operation) {
        JobState state = jobs.get(scopeKey);
        if (state == null || state.status != SyncStatus.PROCESSING) {
            SyncStatus status = state != null ? state.status : SyncStatus.IDLE;
            throw new SyncJobStateException(
                    "Cannot " + operation + " sync job for scope " + scopeKey + " in status " + status);
        }
        return state;
    }

    private static final class JobState {
        private final String scopeKey;
        private final Instant startedAt;
        private SyncStatus status = SyncStatus.PROCESSING;
        private SyncProgress progress = SyncProgress.starting();
        private SyncResult result;
        private String error;
        private Instant updatedAt;
        private Instant finishedAt;

        private JobState(String scopeKey, Instant startedAt) {
            this.scopeKey = scopeKey;
            this.startedAt = startedAt;
            this.updatedAt = startedAt;
        }

        private void finish(Instant now) {
            this.updatedAt = now;
            this.finishedAt = now;
        }

        private SyncJob snapshot() {
            return new SyncJob(scopeKey, status, progress, result, error, startedAt, updatedAt, finishedAt);
        }
    }
}
