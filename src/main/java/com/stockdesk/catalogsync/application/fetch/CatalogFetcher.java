package com.stockdesk.catalogsync.application.fetch;

import com.stockdesk.catalogsync.application.queue.RetryQueue;
import com.stockdesk.catalogsync.application.support.CancellationToken;
import com.stockdesk.catalogsync.application.support.Sleeper;
import com.stockdesk.catalogsync.domain.exception.RateLimitedException;
import com.stockdesk.catalogsync.domain.exception.RetriesExhaustedException;
import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.model.CatalogPage;
import com.stockdesk.catalogsync.domain.port.out.MarketplaceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Pulls a whole catalog page by page, following the marketplace cursor.
 *
 * <p>The loop stops on a short page, a missing cursor, a cursor that did not move, the iteration cap,
 * or after too many consecutive failures. Rate-limited requests are retried after a pause without
 * counting against the error budget. Pages are requested strictly one after another.
 */
public class CatalogFetcher {

    private static final Logger logger = LoggerFactory.getLogger(CatalogFetcher.class);

    private final CatalogFetchProperties properties;
    private final Sleeper sleeper;
    private final RetryQueue retryQueue;

    public CatalogFetcher(CatalogFetchProperties properties, Sleeper sleeper) {
        this(properties, sleeper, null);
    }

    /**
     * @param retryQueue shared outbound queue page requests are dispatched through, or null to call the client directly
     */
    public CatalogFetcher(CatalogFetchProperties properties, Sleeper sleeper, RetryQueue retryQueue) {
        if (properties.getPageSize() < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1");
        }
        this.properties = properties;
        this.sleeper = sleeper;
        this.retryQueue = retryQueue;
    }

    public FetchResult run(MarketplaceClient client, boolean forceRefresh) {
        return run(client, forceRefresh, CancellationToken.none(), FetchListener.NONE);
    }

    /**
     * Fetch the full catalog.
     *
     * @param client source of pages
     * @param forceRefresh passed through to every page request
     * @param token checked before every page request
     * @param listener notified after every accepted page; its exceptions propagate out of this method
     * @return accumulated items and the reason the loop stopped
     */
    public FetchResult run(MarketplaceClient client,
                           boolean forceRefresh,
                           CancellationToken token,
                           FetchListener listener) {
        CancellationToken cancellation = token != null ? token : CancellationToken.none();
        FetchListener pageListener = listener != null ? listener : FetchListener.NONE;

        int pageSize = properties.getPageSize();
        int maxIterations = properties.getMaxIterations();
        int maxConsecutiveErrors = properties.getMaxConsecutiveErrors();

        List<CatalogItem> accumulated = new ArrayList<>();
        String cursor = null;
        int iterationCount = 0;
        int consecutiveErrors = 0;
        int errorCount = 0;
        int totalReported = 0;
        String lastErrorMessage = null;
        boolean allFromCache = true;
        FetchOutcome outcome = null;

        logger.info("Starting catalog fetch (pageSize={}, forceRefresh={})", pageSize, forceRefresh);

        while (outcome == null && iterationCount < maxIterations && consecutiveErrors < maxConsecutiveErrors) {
            if (cancellation.isCancelled()) {
                outcome = FetchOutcome.CANCELLED;
                break;
            }

            CatalogPage page;
            try {
                page = requestPage(client, pageSize, cursor, forceRefresh, cancellation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = FetchOutcome.CANCELLED;
                break;
            } catch (Exception e) {
                Throwable cause = unwrap(e);
                if (cause instanceof CancellationException) {
                    outcome = FetchOutcome.CANCELLED;
                    break;
                }

                if (isRateLimited(cause)) {
                    logger.warn("Rate limited at cursor {}, waiting {} ms", cursor,
                            properties.getRateLimitDelay().toMillis());
                    if (!pause(properties.getRateLimitDelay())) {
                        outcome = FetchOutcome.CANCELLED;
                    }
                    continue;
                }

                consecutiveErrors++;
                errorCount++;
                lastErrorMessage = describe(cause);
                logger.warn("Page request failed ({}/{} consecutive): {}",
                        consecutiveErrors, maxConsecutiveErrors, lastErrorMessage);
                if (consecutiveErrors < maxConsecutiveErrors && !pause(properties.getErrorDelay())) {
                    outcome = FetchOutcome.CANCELLED;
                }
                continue;
            }

            accumulated.addAll(page.items());
            String previousCursor = cursor;
            cursor = page.nextCursor();
            consecutiveErrors = 0;
            iterationCount++;
            if (page.total() > 0) {
                totalReported = page.total();
            }
            allFromCache &= page.fromCache();

            logger.debug("Page {}: {} items, {} accumulated, next cursor {}",
                    iterationCount, page.items().size(), accumulated.size(), cursor);
            pageListener.onPage(page, accumulated.size());

            if (page.items().size() < pageSize) {
                outcome = FetchOutcome.LAST_PAGE;
            } else if (!page.hasNextCursor()) {
                outcome = FetchOutcome.NO_NEXT_PAGE;
            } else if (cursor.equals(previousCursor)) {
                logger.warn("Cursor {} returned twice, stopping", cursor);
                outcome = FetchOutcome.LOOP_DETECTED;
            } else if (iterationCount < maxIterations && !pause(properties.getPageDelay())) {
                outcome = FetchOutcome.CANCELLED;
            }
        }

        if (outcome == null) {
            outcome = consecutiveErrors >= maxConsecutiveErrors
                    ? FetchOutcome.TOO_MANY_ERRORS
                    : FetchOutcome.ITERATION_CAP_REACHED;
        }

        FetchResult result = new FetchResult(accumulated, outcome, iterationCount, totalReported,
                errorCount, lastErrorMessage, iterationCount > 0 && allFromCache);

        if (result.isPartial()) {
            logger.warn("Catalog fetch stopped early after {} pages with {} items: {}",
                    iterationCount, accumulated.size(), result.reason());
        } else {
            logger.info("Catalog fetch finished after {} pages with {} items", iterationCount, accumulated.size());
        }
        return result;
    }

    private CatalogPage requestPage(MarketplaceClient client,
                                    int pageSize,
                                    String cursor,
                                    boolean forceRefresh,
                                    CancellationToken token) throws InterruptedException, ExecutionException {
        CompletableFuture<CatalogPage> request;
        if (retryQueue != null && properties.isDispatchThroughQueue()) {
            // the loop owns retries, the queue only throttles
            request = retryQueue.enqueue(() -> client.fetchPage(pageSize, cursor, forceRefresh), 0, token);
        } else {
            request = client.fetchPage(pageSize, cursor, forceRefresh);
        }

        CatalogPage page = request.get();
        if (page == null) {
            throw new IllegalStateException("Marketplace client returned no page");
        }
        return page;
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean isRateLimited(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof RateLimitedException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException
                || current instanceof CompletionException
                || current instanceof RetriesExhaustedException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
