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

import io.github.resilience4j.retry.Retry;
import io.rasterpyramid.mbtiles.MBTilesMetadata;
import io.rasterpyramid.mbtiles.TileArchiveWriter;
import io.rasterpyramid.tiling.common.BoundingBox2D;
import io.rasterpyramid.tiling.pyramid.TileCover;
import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a tile pyramid for a geographic extent.
 * <p>
 * The tiles covering the extent at the minimum zoom level seed a closed loop: a pool of
 * {@link FetchWorkerPool fetch workers} downloads each requested tile and a single
 * {@link TileStoreWriter writer} stores the non-blank ones and requests their four children, down
 * to the maximum zoom level. The run ends when no fetch task is left queued, in flight, or
 * waiting for the writer, as tracked by {@link OutstandingWork}.
 * <p>
 * Tiles whose fetch keeps failing are dropped and logged; a failure to store a tile aborts the
 * run. The archive is committed but not closed, it remains owned by the caller.
 *
 * <pre>{@code
 * try (MBTilesWriter archive = MBTilesWriter.open(path, config.batchSize())) {
 *     TileFetcher fetcher = new ImageServiceTileFetcher(client, config);
 *     PyramidStats stats = new TilePyramidPipeline(config, fetcher, archive).run(extent);
 * }
 * }</pre>
 */
@NullMarked
public class TilePyramidPipeline {

    private static final Logger log = LoggerFactory.getLogger(TilePyramidPipeline.class);

    private static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final PyramidConfig config;
    private final TileFetcher fetcher;
    private final TileArchiveWriter archive;
    private final BlankTileClassifier blankClassifier;

    public TilePyramidPipeline(PyramidConfig config, TileFetcher fetcher, TileArchiveWriter archive) {
        this(config, fetcher, archive, new ByteLengthBlankTileClassifier());
    }

    public TilePyramidPipeline(
            PyramidConfig config, TileFetcher fetcher, TileArchiveWriter archive, BlankTileClassifier blankClassifier) {
        this.config = requireNonNull(config, "config");
        this.fetcher = requireNonNull(fetcher, "fetcher");
        this.archive = requireNonNull(archive, "archive");
        this.blankClassifier = requireNonNull(blankClassifier, "blankClassifier");
    }

    /**
     * Runs the pipeline to completion.
     *
     * @param extent the area to cover, in {@code EPSG:4326}
     * @return the counters of the run
     * @throws IOException          if the archive fails, or the pipeline breaks down unexpectedly
     * @throws InterruptedException if the calling thread is interrupted while waiting for the run
     */
    public PyramidStats run(BoundingBox2D extent) throws IOException, InterruptedException {
        requireNonNull(extent, "extent");
        final int minZoom = config.minZoom();
        final int maxZoom = config.maxZoom();

        List<TileIndex> baseTiles = TileCover.cover(extent, minZoom);
        log.info("Found {} tiles to fetch at z{}", baseTiles.size(), minZoom);

        archive.writeMetadata(MBTilesMetadata.of(config.name(), config.format(), minZoom, maxZoom)
                .withBounds(extent));

        final PyramidStats stats = new PyramidStats();
        stats.baseTiles(baseTiles.size());

        final PipelineQueue<FetchTask> tasks = PipelineQueue.unbounded("requests");
        final PipelineQueue<FetchResult> results = PipelineQueue.bounded("results", config.resultQueueCapacity());
        final Runnable closeQueues = () -> {
            tasks.close();
            results.close();
        };
        final OutstandingWork outstanding = new OutstandingWork(closeQueues);

        final AtomicReference<Throwable> workerFailure = new AtomicReference<>();
        Retry retry = FetchWorkerPool.newRetry(config.maxAttempts(), config.retryBackoff());
        FetchWorkerPool workers =
                new FetchWorkerPool(config.concurrency(), tasks, results, fetcher, retry, stats, error -> {
                    workerFailure.compareAndSet(null, error);
                    closeQueues.run();
                });
        TileStoreWriter writer =
                new TileStoreWriter(results, tasks, outstanding, archive, blankClassifier, maxZoom, stats);

        ExecutorService writerExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rasterpyramid-writer");
            t.setDaemon(true);
            return t;
        });
        try (ProgressReporter progress = new ProgressReporter(tasks, results, outstanding, stats)) {
            // held while seeding, so the run can't complete before every base tile is queued
            outstanding.increment();

            workers.start();
            Future<?> writerResult = writerExecutor.submit(() -> {
                writer.drain();
                return null;
            });
            progress.start(config.progressInterval());

            seed(baseTiles, tasks, outstanding, stats);
            outstanding.done();

            try {
                writerResult.get();
            } catch (ExecutionException e) {
                closeQueues.run();
                workers.shutdownNow();
                checkWorkerFailure(workerFailure);
                throw asIOException(e.getCause());
            }
            checkWorkerFailure(workerFailure);
            if (!workers.awaitTermination(WORKER_SHUTDOWN_TIMEOUT)) {
                log.warn("Fetch workers did not terminate within {}", WORKER_SHUTDOWN_TIMEOUT);
            }
            progress.report();
            log.info("Pyramid complete: {}", stats);
            log.info("Persisted tiles per zoom level: {}", stats.getPersistedByZoom());
            return stats;
        } catch (InterruptedException e) {
            closeQueues.run();
            throw e;
        } finally {
            workers.shutdownNow();
            writerExecutor.shutdownNow();
        }
    }

    private void seed(
            List<TileIndex> baseTiles,
            PipelineQueue<FetchTask> tasks,
            OutstandingWork outstanding,
            PyramidStats stats)
            throws InterruptedException {
        try {
            for (TileIndex tile : baseTiles) {
                outstanding.increment();
                stats.enqueued();
                tasks.put(new FetchTask(tile));
            }
        } catch (IllegalStateException e) {
            // the queue was closed by a failing worker or writer, reported once the writer ends
            log.warn("Pipeline aborted while seeding base tiles: {}", e.getMessage());
        }
    }

    private static void checkWorkerFailure(AtomicReference<Throwable> workerFailure) throws IOException {
        Throwable failure = workerFailure.get();
        if (failure != null) {
            throw new IOException("Fetch worker failed: " + failure.getMessage(), failure);
        }
    }

    private static IOException asIOException(Throwable cause) {
        if (cause instanceof IOException ioe) {
            return ioe;
        }
        if (cause instanceof UncheckedIOException uioe) {
            return uioe.getCause();
        }
        return new IOException("Pyramid writer failed: " + cause.getMessage(), cause);
    }
}
