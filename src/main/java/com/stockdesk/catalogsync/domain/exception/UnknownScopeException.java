package com.stockdesk.catalogsync.domain.exception;

public class UnknownScopeException extends IllegalArgumentException {

    public UnknownScopeException(String scopeKey) {
        super("No marketplace account configured for scope " + scopeKey);
    }
}
