package com.stockdesk.catalogsync.application.queue;

import com.stockdesk.catalogsync.application.support.CancellationToken;
import com.stockdesk.catalogsync.application.support.ExponentialBackoff;
import com.stockdesk.catalogsync.application.support.Sleeper;
import com.stockdesk.catalogsync.domain.exception.QueueClearedException;
import com.stockdesk.catalogsync.domain.exception.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded-concurrency task runner with retry and exponential backoff.
 *
 * <p>Tasks are drained first-in-first-out in batches of at most {@code concurrency}. The next batch starts only
 * after every task of the current one has reached a terminal state for its attempt. A failed task is re-queued
 * at the tail and its attempt stays open for {@code initialBackoff * 2^retries}, so a retrying task also holds
 * back the rest of its batch.
 *
 * <p>Draining runs on the given executor, one drain at a time. Without one, the queue owns a daemon drain
 * thread that {@link #close()} releases.
 */
public class RetryQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RetryQueue.class);

    private static final AtomicInteger QUEUE_SEQUENCE = new AtomicInteger();
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final RetryQueueProperties properties;
    private final ExponentialBackoff backoff;
    private final Sleeper sleeper;
    private final Executor drainExecutor;
    private final ExecutorService ownedExecutor;
    private volatile Thread drainThread;
    private final AtomicLong taskSequence = new AtomicLong();

    private final Object lock = new Object();
    private final Deque<QueuedTask<?>> pending = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    public RetryQueue(RetryQueueProperties properties) {
        this(properties, Sleeper.threadSleep());
    }

    public RetryQueue(RetryQueueProperties properties, Sleeper sleeper) {
        this(properties, sleeper, null);
    }

    /**
     * @param drainExecutor runs the drain loop; stays open on {@link #close()}. When null the queue starts its own
     *                      single daemon thread
     */
    public RetryQueue(RetryQueueProperties properties, Sleeper sleeper, Executor drainExecutor) {
        if (properties.getConcurrency() < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        if (properties.getDefaultMaxRetries() < 0) {
            throw new IllegalArgumentException("defaultMaxRetries must be non-negative");
        }
        this.properties = properties;
        this.backoff = new ExponentialBackoff(properties.getInitialBackoff());
        this.sleeper = sleeper;

        if (drainExecutor != null) {
            this.ownedExecutor = null;
            this.drainExecutor = drainExecutor;
        } else {
            String threadName = "retry-queue-" + QUEUE_SEQUENCE.incrementAndGet();
            this.ownedExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                return thread;
            });
            this.drainExecutor = ownedExecutor;
        }
    }

    public <T> CompletableFuture<T> enqueue(Supplier<? extends CompletionStage<T>> work) {
        return enqueue(work, properties.getDefaultMaxRetries(), CancellationToken.none());
    }

    public <T> CompletableFuture<T> enqueue(Supplier<? extends CompletionStage<T>> work, int maxRetries) {
        return enqueue(work, maxRetries, CancellationToken.none());
    }

    /**
     * Queue a deferred operation.
     *
     * @param work produces the operation's result; invoked once per attempt
     * @param maxRetries retries allowed after the first attempt
     * @param token checked before every attempt; a cancelled task fails with {@link CancellationException}
     * @return completes with the operation's value, or fails with {@link RetriesExhaustedException},
     *         {@link QueueClearedException} or {@link CancellationException}
     */
    public <T> CompletableFuture<T> enqueue(Supplier<? extends CompletionStage<T>> work,
                                            int maxRetries,
                                            CancellationToken token) {
        QueuedTask<T> task = newTask(work, maxRetries, token);
        admit(List.of(task));
        return task.result;
    }

    /**
     * Queue several operations at once so that a single drain pass sees all of them.
     */
    public <T> List<CompletableFuture<T>> enqueueAll(List<? extends Supplier<? extends CompletionStage<T>>> works,
                                                     int maxRetries) {
        List<QueuedTask<T>> tasks = new ArrayList<>(works.size());
        for (Supplier<? extends CompletionStage<T>> work : works) {
            tasks.add(newTask(work, maxRetries, CancellationToken.none()));
        }
        admit(tasks);
        return tasks.stream().map(task -> task.result).toList();
    }

    /**
     * Reject every pending task with {@link QueueClearedException}. Attempts already running are not affected.
     *
     * @return number of tasks removed
     */
    public int clear() {
        List<QueuedTask<?>> cleared = takePending();
        cleared.forEach(task -> task.result.completeExceptionally(new QueueClearedException()));
        if (!cleared.isEmpty()) {
            logger.info("Cleared {} pending task(s)", cleared.size());
        }
        return cleared.size();
    }

    /**
     * Number of tasks waiting for their next attempt.
     */
    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    @Override
    public void close() {
        List<QueuedTask<?>> rejected;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            rejected = new ArrayList<>(pending);
            pending.clear();
        }
        rejected.forEach(task -> task.result.completeExceptionally(new QueueClearedException("Retry queue closed")));
        Thread thread = drainThread;
        if (thread != null) {
            thread.interrupt();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
        logger.info("Retry queue closed, {} pending task(s) rejected", rejected.size());
    }

    // ===== Draining =====

    private <T> QueuedTask<T> newTask(Supplier<? extends CompletionStage<T>> work,
                                      int maxRetries,
                                      CancellationToken token) {
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(token, "token");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        return new QueuedTask<>(taskSequence.incrementAndGet(), work, maxRetries, token);
    }

    private void admit(List<? extends QueuedTask<?>> tasks) {
        boolean accepted;
        boolean startDrain = false;
        synchronized (lock) {
            accepted = !closed;
            if (accepted) {
                pending.addAll(tasks);
                if (!draining) {
                    draining = true;
                    startDrain = true;
                }
            }
        }

        if (!accepted) {
            tasks.forEach(task -> task.result.completeExceptionally(
                    new RejectedExecutionException("Retry queue is closed")));
            return;
        }

        if (startDrain) {
            try {
                drainExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                logger.error("Drain executor rejected the retry queue", e);
                synchronized (lock) {
                    draining = false;
                }
                takePending().forEach(task -> task.result.completeExceptionally(e));
            }
        }
    }

    private void drain() {
        drainThread = Thread.currentThread();
        try {
            List<QueuedTask<?>> batch;
            while (!(batch = nextBatch()).isEmpty()) {
                runBatch(batch);
                if (size() > 0) {
                    sleeper.sleep(properties.getBatchDelay());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (lock) {
                draining = false;
            }
            List<QueuedTask<?>> rejected = takePending();
            rejected.forEach(task -> task.result.completeExceptionally(
                    new CancellationException("Retry queue interrupted")));
            logger.warn("Retry queue drain interrupted, {} pending task(s) rejected", rejected.size());
        } catch (RuntimeException e) {
            logger.error("Retry queue drain failed", e);
            synchronized (lock) {
                draining = false;
            }
            throw e;
        } finally {
            drainThread = null;
        }
    }

    private List<QueuedTask<?>> nextBatch() {
        synchronized (lock) {
            List<QueuedTask<?>> batch = new ArrayList<>(properties.getConcurrency());
            while (batch.size() < properties.getConcurrency() && !pending.isEmpty()) {
                batch.add(pending.pollFirst());
            }
            if (batch.isEmpty()) {
                draining = false;
            }
            return batch;
        }
    }

    private void runBatch(List<QueuedTask<?>> batch) throws InterruptedException {
        logger.debug("Starting batch of {} task(s), {} waiting", batch.size(), size());

        CompletableFuture<?>[] attempts = batch.stream()
                .map(task -> attempt(task))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(attempts).get();
        } catch (ExecutionException e) {
            // attempts settle their own failures
            throw new IllegalStateException("Batch attempt completed exceptionally", e.getCause());
        }
    }

    private <T> CompletableFuture<Void> attempt(QueuedTask<T> task) {
        if (task.result.isDone()) {
            logger.debug("Skipping task {}: result already settled by the caller", task.id);
            return DONE;
        }
        if (task.token.isCancelled()) {
            task.result.completeExceptionally(
                    new CancellationException("Task " + task.id + " cancelled: " + task.token.reason()));
            return DONE;
        }

        CompletionStage<T> stage;
        try {
            stage = task.work.get();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(
                    new IllegalStateException("Task " + task.id + " produced no result"));
        }

        return stage.toCompletableFuture()
                .handle((value, error) -> error == null ? succeed(task, value) : retryOrReject(task, unwrap(error)))
                .thenCompose(next -> next);
    }

    private <T> CompletableFuture<Void> succeed(QueuedTask<T> task, T value) {
        task.result.complete(value);
        return DONE;
    }

    private CompletableFuture<Void> retryOrReject(QueuedTask<?> task, Throwable error) {
        if (task.token.isCancelled()) {
            CancellationException cancelled =
                    new CancellationException("Task " + task.id + " cancelled: " + task.token.reason());
            cancelled.initCause(error);
            task.result.completeExceptionally(cancelled);
            return DONE;
        }

        if (task.retries < task.maxRetries && !task.result.isDone()) {
            task.retries++;
            boolean requeued;
            synchronized (lock) {
                requeued = !closed;
                if (requeued) {
                    pending.addLast(task);
                }
            }
            if (!requeued) {
                task.result.completeExceptionally(new RejectedExecutionException("Retry queue is closed", error));
                return DONE;
            }

            Duration delay = backoff.delayFor(task.retries);
            logger.warn("Task {} failed on attempt {}/{}, retrying in {} ms: {}",
                    task.id, task.retries, task.maxRetries + 1, delay.toMillis(), error.getMessage());
            return CompletableFuture.runAsync(() -> { },
                    CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        }

        if (task.maxRetries == 0) {
            // single-attempt tasks are retried and reported by the caller
            logger.warn("Task {} failed: {}", task.id, error.getMessage());
        } else {
            logger.error("Task {} failed after {} attempt(s): {}", task.id, task.attempts(), error.getMessage());
        }
        task.result.completeExceptionally(new RetriesExhaustedException(task.id, task.attempts(), error));
        return DONE;
    }

    private List<QueuedTask<?>> takePending() {
        synchronized (lock) {
            List<QueuedTask<?>> taken = new ArrayList<>(pending);
            pending.clear();
            return taken;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class QueuedTask<T> {
        final long id;
        final Supplier<? extends CompletionStage<T>> work;
        final int maxRetries;
        final CancellationToken token;
        final CompletableFuture<T> result = new CompletableFuture<>();

        // only touched by the attempt callbacks, which run one at a time per task
        int retries;

        QueuedTask(long id, Supplier<? extends CompletionStage<T>> work, int maxRetries, CancellationToken token) {
            this.id = id;
            this.work = work;
            this.maxRetries = maxRetries;
            this.token = token;
        }

        int attempts() {
            return retries + 1;
        }
    }
}
