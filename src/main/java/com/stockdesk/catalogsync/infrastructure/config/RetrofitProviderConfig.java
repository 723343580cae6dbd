package com.stockdesk.catalogsync.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.MarketplaceApiProperties;
import com.stockdesk.catalogsync.infrastructure.adapter.marketplace.MarketplaceCatalogApi;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

/**
 * Builds a Retrofit catalog API per marketplace account.
 * Each account gets its own base URL and authentication headers.
 */
@Component
public class RetrofitProviderConfig {

    static final String CLIENT_ID_HEADER = "Client-Id";
    static final String API_KEY_HEADER = "Api-Key";

    private final MarketplaceApiProperties properties;
    private final ObjectMapper jsonMapper;

    public RetrofitProviderConfig(MarketplaceApiProperties properties) {
        this.properties = properties;
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.registerModule(new JavaTimeModule());
        this.jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MarketplaceCatalogApi catalogApi(MarketplaceApiProperties.Account account) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .addInterceptor(chain -> {
                    var request = chain.request().newBuilder();
                    if (account.getClientId() != null) {
                        request.header(CLIENT_ID_HEADER, account.getClientId());
                    }
                    if (account.getApiKey() != null) {
                        request.header(API_KEY_HEADER, account.getApiKey());
                    }
                    return chain.proceed(request.build());
                })
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizeBaseUrl(account.getBaseUrl()))
                .client(httpClient)
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper))
                .build();

        return retrofit.create(MarketplaceCatalogApi.class);
    }

    // Retrofit resolves relative paths against the base URL only when it ends with a slash
    static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Marketplace base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
