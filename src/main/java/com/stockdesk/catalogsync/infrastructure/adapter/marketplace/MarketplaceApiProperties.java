package com.stockdesk.catalogsync.infrastructure.adapter.marketplace;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Marketplace accounts keyed by scope, plus HTTP and local-cache settings shared by all of them
 */
@ConfigurationProperties(prefix = "catalog.marketplace")
public class MarketplaceApiProperties {

    private Map<String, Account> accounts = new HashMap<>();
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
    private Duration cacheFreshness = Duration.ofHours(1);

    public Map<String, Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(Map<String, Account> accounts) {
        this.accounts = accounts;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getCacheFreshness() {
        return cacheFreshness;
    }

    public void setCacheFreshness(Duration cacheFreshness) {
        this.cacheFreshness = cacheFreshness;
    }

    public static class Account {

        private String baseUrl;
        private String clientId;
        private String apiKey;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
