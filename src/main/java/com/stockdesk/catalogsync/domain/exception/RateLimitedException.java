package com.stockdesk.catalogsync.domain.exception;

/**
 * Signals that the marketplace rejected a request because of its rate limit.
 * Callers wait and retry the same request without treating it as an error.
 */
public class RateLimitedException extends RuntimeException {

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
