package com.stockdesk.catalogsync.application;

import com.stockdesk.catalogsync.application.fetch.CatalogFetchProperties;
import com.stockdesk.catalogsync.application.fetch.CatalogFetcher;
import com.stockdesk.catalogsync.application.progress.SyncProgressTracker;
import com.stockdesk.catalogsync.domain.exception.MarketplaceApiException;
import com.stockdesk.catalogsync.domain.exception.SyncAlreadyRunningException;
import com.stockdesk.catalogsync.domain.exception.UnknownScopeException;
import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.domain.model.SyncJob;
import com.stockdesk.catalogsync.domain.model.SyncStatus;
import com.stockdesk.catalogsync.domain.port.out.CatalogStore;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClientProvider;
import com.stockdesk.catalogsync.domain.port.out.SyncMetadataService;
import com.stockdesk.catalogsync.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogSyncUseCaseTest {

    private static final String SCOPE = "acme";
    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Mock
    private MarketplaceClientProvider clientProvider;

    @Mock
    private MarketplaceClient client;

    @Mock
    private CatalogStore catalogStore;

    @Mock
    private SyncMetadataService syncMetadata;

    private final List<Runnable> scheduledRuns = new ArrayList<>();
    private SyncProgressTracker tracker;
    private CatalogFetcher fetcher;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        tracker = new SyncProgressTracker(clock);
        CatalogFetchProperties properties = new CatalogFetchProperties();
        properties.setDispatchThroughQueue(false);
        fetcher = new CatalogFetcher(properties, duration -> { });
    }

    @Test
    void shouldSyncAllPagesAndRecordMetadata() {
        // Given
        CatalogSyncUseCase useCase = useCase(Runnable::run);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "c1", 130));
        when(client.fetchPage(100, "c1", true)).thenReturn(page(30, null, 130));

        // When
        useCase.startSync(SCOPE, true);

        // Then
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(job.progress().current()).isEqualTo(130);
        assertThat(job.progress().total()).isEqualTo(130);
        assertThat(job.progress().stage()).isEqualTo("Fetched 130 items");
        assertThat(job.result().syncedCount()).isEqualTo(130);
        assertThat(job.result().partial()).isFalse();

        verify(catalogStore, times(2)).saveAll(eq(SCOPE), anyList());
        InOrder metadataOrder = inOrder(syncMetadata);
        metadataOrder.verify(syncMetadata).updateSyncStatus(SCOPE, "PROCESSING");
        metadataOrder.verify(syncMetadata).updateLastSyncTime(SCOPE, NOW);
        metadataOrder.verify(syncMetadata).updateItemCount(SCOPE, 130);
        metadataOrder.verify(syncMetadata).updateSyncStatus(SCOPE, "COMPLETED");
    }

    @Test
    void shouldNotRewriteLocalCopyWhenSyncIsServedFromIt() {
        // Given
        CatalogSyncUseCase useCase = useCase(Runnable::run);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        when(client.fetchPage(100, null, false)).thenReturn(cachedPage(100, "local:100", 140));
        when(client.fetchPage(100, "local:100", false)).thenReturn(cachedPage(40, null, 140));

        // When
        useCase.startSync(SCOPE, false);

        // Then
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(job.result().syncedCount()).isEqualTo(140);
        verifyNoInteractions(catalogStore);
        verify(syncMetadata, never()).updateLastSyncTime(any(), any());
        verify(syncMetadata, never()).updateItemCount(any(), anyInt());
        verify(syncMetadata).updateSyncStatus(SCOPE, "COMPLETED");
    }

    @Test
    void shouldPropagateUnknownScope() {
        // Given
        CatalogSyncUseCase useCase = useCase(Runnable::run);
        when(clientProvider.forScope("nope")).thenThrow(new UnknownScopeException("nope"));

        // When & Then
        assertThatThrownBy(() -> useCase.startSync("nope", true)).isInstanceOf(UnknownScopeException.class);
        assertThat(useCase.getSyncProgress("nope").status()).isEqualTo(SyncStatus.IDLE);
    }

    @Test
    void shouldRejectSecondSyncForSameScope() {
        // Given
        CatalogSyncUseCase useCase = useCase(scheduledRuns::add);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        useCase.startSync(SCOPE, true);

        // When & Then
        assertThatThrownBy(() -> useCase.startSync(SCOPE, true)).isInstanceOf(SyncAlreadyRunningException.class);
        assertThat(scheduledRuns).hasSize(1);
    }

    @Test
    void shouldFailJobWhenEveryRequestFails() {
        // Given
        CatalogSyncUseCase useCase = useCase(Runnable::run);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        when(client.fetchPage(100, null, true)).thenReturn(
                CompletableFuture.failedFuture(new MarketplaceApiException("Marketplace returned HTTP 503", 503)));

        // When
        useCase.startSync(SCOPE, true);

        // Then
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(job.error()).isEqualTo("Marketplace returned HTTP 503");
        verify(syncMetadata).updateSyncStatus(SCOPE, "ERROR");
        verify(syncMetadata, never()).updateLastSyncTime(any(), any());
        verifyNoInteractions(catalogStore);
    }

    @Test
    void shouldCompleteAsPartialWhenLoopDetected() {
        // Given
        CatalogSyncUseCase useCase = useCase(Runnable::run);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "same", 0));
        when(client.fetchPage(100, "same", true)).thenReturn(page(100, "same", 0));

        // When
        useCase.startSync(SCOPE, true);

        // Then
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.COMPLETED);
        assertThat(job.result().partial()).isTrue();
        assertThat(job.result().stopReason()).isEqualTo("no progress detected");
        assertThat(job.result().syncedCount()).isEqualTo(200);
        verify(syncMetadata, never()).updateLastSyncTime(any(), any());
        verify(syncMetadata).updateSyncStatus(SCOPE, "COMPLETED");
    }

    @Test
    void shouldFailJobWhenStoreFails() {
        // Given
        CatalogSyncUseCase useCase = useCase(Runnable::run);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        when(client.fetchPage(100, null, true)).thenReturn(page(100, "c1", 0));
        doThrow(new IllegalStateException("database down")).when(catalogStore).saveAll(eq(SCOPE), anyList());

        // When
        useCase.startSync(SCOPE, true);

        // Then
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(job.error()).isEqualTo("database down");
        verify(client, never()).fetchPage(100, "c1", true);
    }

    @Test
    void shouldFailJobWhenExecutorRejectsRun() {
        // Given
        CatalogSyncUseCase useCase = useCase(runnable -> {
            throw new RejectedExecutionException("pool saturated");
        });
        when(clientProvider.forScope(SCOPE)).thenReturn(client);

        // When
        SyncJob job = useCase.startSync(SCOPE, true);

        // Then
        assertThat(job.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(job.error()).contains("pool saturated");
        verify(syncMetadata).updateSyncStatus(SCOPE, "ERROR");
    }

    @Test
    void shouldCancelRunningSync() {
        // Given
        CatalogSyncUseCase useCase = useCase(scheduledRuns::add);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        SyncJob started = useCase.startSync(SCOPE, true);

        // When
        boolean cancelled = useCase.cancelSync(SCOPE);
        scheduledRuns.get(0).run();

        // Then
        assertThat(started.status()).isEqualTo(SyncStatus.PROCESSING);
        assertThat(cancelled).isTrue();
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(job.error()).isEqualTo("Sync cancelled: cancelled by request");
        verify(client, never()).fetchPage(anyInt(), any(), anyBoolean());
    }

    @Test
    void shouldReportNothingToCancelWhenIdle() {
        CatalogSyncUseCase useCase = useCase(Runnable::run);

        assertThat(useCase.cancelSync(SCOPE)).isFalse();
    }

    @Test
    void shouldFailAbandonedSyncImmediatelyAndIgnoreItsLateResult() {
        // Given
        CatalogSyncUseCase useCase = useCase(scheduledRuns::add);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        useCase.startSync(SCOPE, true);

        // When
        useCase.abandonSync(SCOPE, "Sync timed out");
        scheduledRuns.get(0).run();

        // Then
        SyncJob job = useCase.getSyncProgress(SCOPE);
        assertThat(job.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(job.error()).isEqualTo("Sync timed out");
        verify(client, never()).fetchPage(anyInt(), any(), anyBoolean());
    }

    @Test
    void shouldNotLetAbandonedRunTouchNewerJob() {
        // Given
        CatalogSyncUseCase useCase = useCase(scheduledRuns::add);
        when(clientProvider.forScope(SCOPE)).thenReturn(client);
        useCase.startSync(SCOPE, true);
        useCase.abandonSync(SCOPE, "Sync timed out");
        useCase.startSync(SCOPE, true);

        // When - the first run wakes up after the second one started
        scheduledRuns.get(0).run();

        // Then
        assertThat(useCase.getSyncProgress(SCOPE).status()).isEqualTo(SyncStatus.PROCESSING);
        assertThat(useCase.cancelSync(SCOPE)).isTrue();
    }

    private CatalogSyncUseCase useCase(Executor executor) {
        return new CatalogSyncUseCase(clientProvider, catalogStore, syncMetadata, fetcher, tracker, executor, clock);
    }

    private static CompletableFuture<CatalogPage> page(int size, String nextCursor, int total) {
        List<CatalogItem> items = IntStream.range(0, size)
                .mapToObj(i -> new CatalogItem("sku-" + i, null, "Item " + i, BigDecimal.ONE, 1))
                .toList();
        return CompletableFuture.completedFuture(new CatalogPage(items, nextCursor, total, false));
    }

    private static CompletableFuture<CatalogPage> cachedPage(int size, String nextCursor, int total) {
        CatalogPage page = page(size, nextCursor, total).join();
        return CompletableFuture.completedFuture(new CatalogPage(page.items(), nextCursor, total, true));
    }
}
