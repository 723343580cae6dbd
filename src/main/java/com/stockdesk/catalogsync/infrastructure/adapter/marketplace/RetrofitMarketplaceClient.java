package com.stockdesk.catalogsync.infrastructure.adapter.marketplace;

import com.stockdesk.catalogsync.domain.exception.MarketplaceApiException;
import com.stockdesk.catalogsync.domain.exception.RateLimitedException;
import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.domain.model.CatalogSnapshot;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import com.stockdesk.catalogsync.infrastructure.adapter.mapper.CatalogItemMapper;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.json.CatalogPageJson;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Response;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Marketplace client for one account, calling its HTTP API through Retrofit.
 * Calls run on the given executor behind the account's circuit breaker.
 */
public class RetrofitMarketplaceClient implements MarketplaceClient {

    private static final Logger logger = LoggerFactory.getLogger(RetrofitMarketplaceClient.class);

    private static final int TOO_MANY_REQUESTS = 429;

    private final String scopeKey;
    private final MarketplaceCatalogApi catalogApi;
    private final CatalogItemMapper itemMapper;
    private final CircuitBreaker circuitBreaker;
    private final Executor executor;

    public RetrofitMarketplaceClient(String scopeKey,
                                     MarketplaceCatalogApi catalogApi,
                                     CatalogItemMapper itemMapper,
                                     CircuitBreaker circuitBreaker,
                                     Executor executor) {
        this.scopeKey = scopeKey;
        this.catalogApi = catalogApi;
        this.itemMapper = itemMapper;
        this.circuitBreaker = circuitBreaker;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<CatalogPage> fetchPage(int limit, String cursor, boolean forceRefresh) {
        return circuitBreaker.executeCompletionStage(
                () -> CompletableFuture.supplyAsync(() -> requestPage(limit, cursor), executor)
        ).toCompletableFuture();
    }

    @Override
    public CompletableFuture<CatalogSnapshot> fetchAll(int limit) {
        return fetchPage(limit, null, true)
                .thenApply(page -> new CatalogSnapshot(page.items(), false));
    }

    private CatalogPage requestPage(int limit, String cursor) {
        logger.debug("Requesting {} catalog items for scope {} at cursor {}", limit, scopeKey, cursor);

        Response<CatalogPageJson> response;
        try {
            response = catalogApi.fetchItems(limit, cursor).execute();
        } catch (IOException e) {
            logger.error("I/O error calling marketplace for scope {}: {}", scopeKey, e.getMessage());
            throw new MarketplaceApiException("Failed to reach marketplace for scope " + scopeKey, e);
        }

        if (response.code() == TOO_MANY_REQUESTS) {
            logger.warn("Marketplace rate limit hit for scope {}", scopeKey);
            throw new RateLimitedException("Marketplace rate limit exceeded for scope " + scopeKey);
        }
        if (!response.isSuccessful()) {
            logger.warn("Marketplace returned HTTP {} for scope {}", response.code(), scopeKey);
            throw new MarketplaceApiException(
                    "Marketplace returned HTTP " + response.code() + " for scope " + scopeKey, response.code());
        }
        if (response.body() == null) {
            throw new MarketplaceApiException("Empty response from marketplace for scope " + scopeKey, response.code());
        }

        return itemMapper.mapToPage(response.body());
    }
}
