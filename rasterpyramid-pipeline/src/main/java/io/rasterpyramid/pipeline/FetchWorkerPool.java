/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.rasterpyramid.pipeline;

import static java.util.Objects.requireNonNull;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed set of worker threads that take {@link FetchTask}s, fetch their tiles with retries, and
 * hand a {@link FetchResult} for every task to the result queue.
 * <p>
 * A fetch that keeps failing once its attempts are exhausted produces a failed result rather than
 * an exception, so the tile is dropped without stopping the run. Workers exit when the task queue
 * is closed and drained. An unexpected error escaping a worker is reported to the fatal error
 * handler, which is expected to abort the run.
 */
@NullMarked
class FetchWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(FetchWorkerPool.class);

    private static final ThreadFactory workerThreadFactory = new ThreadFactory() {
        private static final AtomicInteger workerThreadId = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("rasterpyramid-fetch-%d".formatted(workerThreadId.incrementAndGet()));
            return t;
        }
    };

    private final int concurrency;
    private final PipelineQueue<FetchTask> tasks;
    private final PipelineQueue<FetchResult> results;
    private final TileFetcher fetcher;
    private final Retry retry;
    private final PyramidStats stats;
    private final Consumer<Throwable> fatalErrorHandler;

    private final ExecutorService executor;

    FetchWorkerPool(
            int concurrency,
            PipelineQueue<FetchTask> tasks,
            PipelineQueue<FetchResult> results,
            TileFetcher fetcher,
            Retry retry,
            PyramidStats stats,
            Consumer<Throwable> fatalErrorHandler) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.concurrency = concurrency;
        this.tasks = requireNonNull(tasks);
        this.results = requireNonNull(results);
        this.fetcher = requireNonNull(fetcher);
        this.retry = requireNonNull(retry);
        this.stats = requireNonNull(stats);
        this.fatalErrorHandler = requireNonNull(fatalErrorHandler);
        this.executor = Executors.newFixedThreadPool(concurrency, workerThreadFactory);
        retry.getEventPublisher().onRetry(event -> {
            stats.retried();
            log.debug(
                    "Fetch attempt {} failed, retrying in {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    String.valueOf(event.getLastThrowable()));
        });
    }

    /**
     * Creates the retry policy for tile fetches: up to {@code maxAttempts} attempts in total,
     * waiting {@code backoff} before the first retry and doubling the wait after each failure.
     * <p>
     * Only {@link IOException}s are retried; an interrupted fetch is not.
     */
    static Retry newRetry(int maxAttempts, Duration backoff) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(backoff, 2.0))
                .retryExceptions(IOException.class)
                .ignoreExceptions(InterruptedIOException.class)
                .build();
        return Retry.of("tile-fetch", config);
    }

    void start() {
        for (int i = 0; i < concurrency; i++) {
            executor.execute(this::runWorker);
        }
        log.debug("Started {} fetch workers", concurrency);
    }

    private void runWorker() {
        try {
            Optional<FetchTask> next;
            while ((next = tasks.take()).isPresent()) {
                FetchResult result = fetch(next.get().tile());
                results.put(result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Fetch worker interrupted");
        } catch (IllegalStateException e) {
            if (results.isClosed()) {
                log.debug("Result queue closed, fetch worker exiting");
            } else {
                fatalErrorHandler.accept(e);
            }
        } catch (RuntimeException | Error e) {
            log.error("Fetch worker failed unexpectedly", e);
            fatalErrorHandler.accept(e);
        }
    }

    /**
     * Fetches a tile, retrying failed attempts.
     *
     * @return the successful result, or a failed one once all attempts failed
     * @throws InterruptedException if the fetching thread was interrupted
     */
    FetchResult fetch(TileIndex tile) throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        try {
            byte[] data = retry.executeCallable(() -> {
                attempts.incrementAndGet();
                return fetcher.fetch(tile);
            });
            stats.fetched();
            return FetchResult.success(tile, data, attempts.get());
        } catch (InterruptedIOException e) {
            throw interrupted(tile, e);
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                throw interrupted(tile, e);
            }
            log.warn("Dropping tile {} after {} attempts: {}", tile, attempts.get(), e.getMessage());
            return FetchResult.failed(tile, e, attempts.get());
        }
    }

    private static InterruptedException interrupted(TileIndex tile, Exception cause) {
        InterruptedException interrupted = new InterruptedException("Interrupted fetching " + tile);
        interrupted.initCause(cause);
        return interrupted;
    }

    /**
     * Waits for all workers to exit after the task queue was closed.
     *
     * @return {@code true} if all workers exited within the timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupts all workers.
     */
    void shutdownNow() {
        executor.shutdownNow();
    }
}
