package com.stockdesk.catalogsync.domain.exception;

public class MarketplaceApiException extends RuntimeException {

    private final int statusCode;

    public MarketplaceApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public MarketplaceApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the marketplace, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
