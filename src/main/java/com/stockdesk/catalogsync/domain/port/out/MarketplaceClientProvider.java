package com.stockdesk.catalogsync.domain.port.out;

public interface MarketplaceClientProvider {

    /**
     * @throws com.stockdesk.catalogsync.domain.exception.UnknownScopeException if no account is configured for the scope
     */
    MarketplaceClient forScope(String scopeKey);
}
