package com.stockdesk.catalogsync.domain.exception;

/**
 * A queued task failed on every allowed attempt. The cause is the last observed failure.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final long taskId;
    private final int attempts;

    public RetriesExhaustedException(long taskId, int attempts, Throwable lastFailure) {
        super("Task " + taskId + " failed after " + attempts + " attempt(s): "
                + (lastFailure != null ? lastFailure.getMessage() : "unknown error"), lastFailure);
        this.taskId = taskId;
        this.attempts = attempts;
    }

    public long getTaskId() {
        return taskId;
    }

    public int getAttempts() {
        return attempts;
    }
}
