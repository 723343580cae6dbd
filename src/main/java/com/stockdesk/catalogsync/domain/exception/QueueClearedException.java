package com.stockdesk.catalogsync.domain.exception;

public class QueueClearedException extends RuntimeException {

    public QueueClearedException() {
        super("Queue cleared");
    }

    public QueueClearedException(String message) {
        super(message);
    }
}
