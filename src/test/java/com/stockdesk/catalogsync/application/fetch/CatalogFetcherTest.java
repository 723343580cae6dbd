package com.stockdesk.catalogsync.application.fetch;

import com.stockdesk.catalogsync.application.queue.RetryQueue;
import com.stockdesk.catalogsync.application.queue.RetryQueueProperties;
import com.stockdesk.catalogsync.application.support.CancellationToken;
import com.stockdesk.catalogsync.domain.exception.MarketplaceApiException;
import com.stockdesk.catalogsync.domain.exception.RateLimitedException;
import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogFetcherTest {

    private static final Duration PAGE_DELAY = Duration.ofMillis(300);
    private static final Duration RATE_LIMIT_DELAY = Duration.ofSeconds(2);
    private static final Duration ERROR_DELAY = Duration.ofSeconds(1);

    @Mock
    private MarketplaceClient client;

    private final List<Duration> sleeps = new ArrayList<>();
    private CatalogFetchProperties properties;
    private CatalogFetcher fetcher;

    @BeforeEach
    void setUp() {
        properties = new CatalogFetchProperties();
        properties.setDispatchThroughQueue(false);
        fetcher = new CatalogFetcher(properties, sleeps::add);
    }

    @Test
    void shouldFetchUntilShortPage() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "c1"));
        when(client.fetchPage(100, "c1", true)).thenReturn(page(100, "c2"));
        when(client.fetchPage(100, "c2", true)).thenReturn(page(40, "c3"));
        List<Integer> reported = new ArrayList<>();

        // When
        FetchResult result = fetcher.run(client, true, new CancellationToken(),
                (page, accumulated) -> reported.add(accumulated));

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
        assertThat(result.isPartial()).isFalse();
        assertThat(result.items()).hasSize(240);
        assertThat(result.pagesFetched()).isEqualTo(3);
        assertThat(reported).containsExactly(100, 200, 240);
        assertThat(sleeps).containsExactly(PAGE_DELAY, PAGE_DELAY);
        verify(client, never()).fetchPage(100, "c3", true);
    }

    @Test
    void shouldStopWhenCursorDoesNotMove() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "A"));
        when(client.fetchPage(100, "A", true)).thenReturn(page(100, "A"));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LOOP_DETECTED);
        assertThat(result.reason()).isEqualTo("no progress detected");
        assertThat(result.isPartial()).isTrue();
        assertThat(result.items()).hasSize(200);
        verify(client, times(2)).fetchPage(anyInt(), any(), anyBoolean());
    }

    @Test
    void shouldStopWhenFullPageHasNoCursor() {
        // Given
        when(client.fetchPage(100, null, false)).thenReturn(page(100, null));

        // When
        FetchResult result = fetcher.run(client, false);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.NO_NEXT_PAGE);
        assertThat(result.items()).hasSize(100);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldFinishOnEmptyFirstPage() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(page(0, "ignored"));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
        assertThat(result.items()).isEmpty();
        assertThat(result.pagesFetched()).isEqualTo(1);
    }

    @Test
    void shouldStopAtIterationCap() {
        // Given
        properties.setMaxIterations(3);
        when(client.fetchPage(eq(100), any(), eq(true))).thenAnswer(invocation -> {
            String cursor = invocation.getArgument(1);
            return page(100, cursor == null ? "p1" : cursor + "+");
        });

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.ITERATION_CAP_REACHED);
        assertThat(result.items()).hasSize(300);
        assertThat(sleeps).containsExactly(PAGE_DELAY, PAGE_DELAY);
    }

    @Test
    void shouldWaitAndRetrySamePageWhenRateLimited() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(
                CompletableFuture.failedFuture(new RateLimitedException("slow down")),
                page(10, null));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
        assertThat(result.items()).hasSize(10);
        assertThat(result.errorCount()).isZero();
        assertThat(sleeps).containsExactly(RATE_LIMIT_DELAY);
    }

    @Test
    void shouldNotSpendErrorBudgetOnRateLimits() {
        // Given - five throttled responses in a row would exhaust a budget of three
        CompletableFuture<CatalogPage> throttled =
                CompletableFuture.failedFuture(new RateLimitedException("Marketplace rate limit exceeded"));
        when(client.fetchPage(100, null, true)).thenReturn(
                throttled, throttled, throttled, throttled, throttled, page(5, null));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
        assertThat(result.items()).hasSize(5);
        assertThat(sleeps).hasSize(5).containsOnly(RATE_LIMIT_DELAY);
    }

    @Test
    void shouldSpendErrorBudgetOnOtherErrorsMentioningRateLimit() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("Rate limit config missing for proxy")));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.TOO_MANY_ERRORS);
        assertThat(result.errorCount()).isEqualTo(3);
        assertThat(sleeps).containsOnly(ERROR_DELAY);
    }

    @Test
    void shouldGiveUpAfterConsecutiveErrors() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(
                CompletableFuture.failedFuture(new MarketplaceApiException("Marketplace returned HTTP 500", 500)));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.TOO_MANY_ERRORS);
        assertThat(result.items()).isEmpty();
        assertThat(result.errorCount()).isEqualTo(3);
        assertThat(result.lastErrorMessage()).isEqualTo("Marketplace returned HTTP 500");
        assertThat(result.reason()).isEqualTo("too many errors: Marketplace returned HTTP 500");
        assertThat(sleeps).containsExactly(ERROR_DELAY, ERROR_DELAY);
        verify(client, times(3)).fetchPage(100, null, true);
    }

    @Test
    void shouldResetErrorBudgetAfterSuccessfulPage() {
        // Given
        CompletableFuture<CatalogPage> failure =
                CompletableFuture.failedFuture(new MarketplaceApiException("timeout", new RuntimeException()));
        when(client.fetchPage(100, null, true)).thenReturn(failure, failure, page(100, "c1"));
        when(client.fetchPage(100, "c1", true)).thenReturn(failure, failure, page(20, null));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
        assertThat(result.items()).hasSize(120);
        assertThat(result.errorCount()).isEqualTo(4);
    }

    @Test
    void shouldCountSynchronousClientFailureAsError() {
        // Given
        when(client.fetchPage(100, null, true))
                .thenThrow(new IllegalStateException("connection pool shut down"))
                .thenReturn(page(1, null));

        // When
        FetchResult result = fetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(sleeps).containsExactly(ERROR_DELAY);
    }

    @Test
    void shouldStopWhenCancelledBetweenPages() {
        // Given
        CancellationToken token = new CancellationToken();
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "c1"));

        // When
        FetchResult result = fetcher.run(client, true, token, (page, accumulated) -> token.cancel("stop"));

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.CANCELLED);
        assertThat(result.items()).hasSize(100);
        assertThat(result.isPartial()).isTrue();
        verify(client, never()).fetchPage(100, "c1", true);
    }

    @Test
    void shouldTreatInterruptedPauseAsCancellation() {
        // Given
        CatalogFetcher interruptedFetcher = new CatalogFetcher(properties, duration -> {
            throw new InterruptedException("shutdown");
        });
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "c1"));

        // When
        FetchResult result = interruptedFetcher.run(client, true);

        // Then
        assertThat(result.outcome()).isEqualTo(FetchOutcome.CANCELLED);
        assertThat(result.items()).hasSize(100);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void shouldPropagateListenerFailure() {
        // Given
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "c1"));

        // When & Then
        assertThatThrownBy(() -> fetcher.run(client, true, new CancellationToken(), (page, accumulated) -> {
            throw new IllegalStateException("store unavailable");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("store unavailable");
    }

    @Test
    void shouldReportCachedResultOnlyWhenEveryPageCameFromCache() {
        // Given
        when(client.fetchPage(100, null, false)).thenReturn(
                CompletableFuture.completedFuture(new CatalogPage(items(100), "100", 150, true)));
        when(client.fetchPage(100, "100", false)).thenReturn(
                CompletableFuture.completedFuture(new CatalogPage(items(50), null, 150, true)));

        // When
        FetchResult result = fetcher.run(client, false);

        // Then
        assertThat(result.fromCache()).isTrue();
        assertThat(result.totalReported()).isEqualTo(150);
    }

    @Test
    void shouldDispatchRequestsThroughQueueWithoutQueueRetries() {
        // Given
        RetryQueueProperties queueProperties = new RetryQueueProperties();
        queueProperties.setInitialBackoff(Duration.ofMillis(1));
        queueProperties.setBatchDelay(Duration.ZERO);
        try (RetryQueue queue = new RetryQueue(queueProperties)) {
            properties.setDispatchThroughQueue(true);
            CatalogFetcher queuedFetcher = new CatalogFetcher(properties, sleeps::add, queue);
            when(client.fetchPage(100, null, true)).thenReturn(
                    CompletableFuture.failedFuture(new MarketplaceApiException("Marketplace returned HTTP 502", 502)),
                    page(30, null));

            // When
            FetchResult result = queuedFetcher.run(client, true);

            // Then - the queue makes one attempt, the fetch loop owns the retry
            assertThat(result.outcome()).isEqualTo(FetchOutcome.LAST_PAGE);
            assertThat(result.errorCount()).isEqualTo(1);
            assertThat(result.lastErrorMessage()).isEqualTo("Marketplace returned HTTP 502");
            assertThat(sleeps).containsExactly(ERROR_DELAY);
            verify(client, times(2)).fetchPage(100, null, true);
        }
    }

    @Test
    void shouldRecogniseRateLimitAnywhereInCauseChain() {
        assertThat(CatalogFetcher.isRateLimited(new RateLimitedException("x"))).isTrue();
        assertThat(CatalogFetcher.isRateLimited(new RuntimeException("wrapper",
                new RateLimitedException("Marketplace rate limit exceeded")))).isTrue();
        assertThat(CatalogFetcher.isRateLimited(new RuntimeException("rate limit reached"))).isFalse();
    }

    private static CompletableFuture<CatalogPage> page(int size, String nextCursor) {
        return CompletableFuture.completedFuture(new CatalogPage(items(size), nextCursor, 0, false));
    }

    private static List<CatalogItem> items(int size) {
        return IntStream.range(0, size)
                .mapToObj(i -> new CatalogItem("sku-" + i, "offer-" + i, "Item " + i, BigDecimal.TEN, i % 3))
                .toList();
    }
}
