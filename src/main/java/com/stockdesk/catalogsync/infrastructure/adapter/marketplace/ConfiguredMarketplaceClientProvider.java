package com.stockdesk.catalogsync.infrastructure.adapter.marketplace;

import com.stockdesk.catalogsync.domain.exception.UnknownScopeException;
import com.stockdesk.catalogsync.domain.port.out.CatalogStore;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClientProvider;
import com.stockdesk.catalogsync.domain.port.out.SyncMetadataService;
import com.stockdesk.catalogsync.infrastructure.adapter.mapper.CatalogItemMapper;
import com.stockdesk.catalogsync.infrastructure.config.RetrofitProviderConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Resolves scopes to the marketplace accounts configured under {@code catalog.marketplace.accounts}.
 * Clients are built once per scope and reused.
 */
@Component
public class ConfiguredMarketplaceClientProvider implements MarketplaceClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(ConfiguredMarketplaceClientProvider.class);

    private final MarketplaceApiProperties properties;
    private final RetrofitProviderConfig retrofitConfig;
    private final CatalogItemMapper itemMapper;
    private final CatalogStore catalogStore;
    private final SyncMetadataService syncMetadata;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Executor marketplaceExecutor;
    private final Clock clock;

    private final Map<String, MarketplaceClient> clients = new ConcurrentHashMap<>();

    public ConfiguredMarketplaceClientProvider(MarketplaceApiProperties properties,
                                               RetrofitProviderConfig retrofitConfig,
                                               CatalogItemMapper itemMapper,
                                               CatalogStore catalogStore,
                                               SyncMetadataService syncMetadata,
                                               CircuitBreakerRegistry circuitBreakerRegistry,
                                               @Qualifier("marketplaceExecutor") Executor marketplaceExecutor,
                                               Clock clock) {
        this.properties = properties;
        this.retrofitConfig = retrofitConfig;
        this.itemMapper = itemMapper;
        this.catalogStore = catalogStore;
        this.syncMetadata = syncMetadata;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.marketplaceExecutor = marketplaceExecutor;
        this.clock = clock;
    }

    @Override
    public MarketplaceClient forScope(String scopeKey) {
        MarketplaceApiProperties.Account account = properties.getAccounts().get(scopeKey);
        if (account == null) {
            throw new UnknownScopeException(scopeKey);
        }
        return clients.computeIfAbsent(scopeKey, key -> createClient(key, account));
    }

    private MarketplaceClient createClient(String scopeKey, MarketplaceApiProperties.Account account) {
        logger.info("Creating marketplace client for scope {} at {}", scopeKey, account.getBaseUrl());

        RetrofitMarketplaceClient remoteClient = new RetrofitMarketplaceClient(
                scopeKey,
                retrofitConfig.catalogApi(account),
                itemMapper,
                circuitBreakerRegistry.circuitBreaker("marketplace-" + scopeKey),
                marketplaceExecutor);

        return new CachingMarketplaceClient(
                scopeKey,
                remoteClient,
                catalogStore,
                syncMetadata,
                properties.getCacheFreshness(),
                clock);
    }
}
