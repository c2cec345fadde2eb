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

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically logs queue depths and counters of a running pyramid.
 */
@NullMarked
class ProgressReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final PipelineQueue<FetchTask> tasks;
    private final PipelineQueue<FetchResult> results;
    private final OutstandingWork outstanding;
    private final PyramidStats stats;

    private @Nullable ScheduledExecutorService scheduler;

    ProgressReporter(
            PipelineQueue<FetchTask> tasks,
            PipelineQueue<FetchResult> results,
            OutstandingWork outstanding,
            PyramidStats stats) {
        this.tasks = requireNonNull(tasks);
        this.results = requireNonNull(results);
        this.outstanding = requireNonNull(outstanding);
        this.stats = requireNonNull(stats);
    }

    synchronized void start(Duration interval) {
        if (scheduler != null) {
            throw new IllegalStateException("already started");
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rasterpyramid-progress");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        executor.scheduleAtFixedRate(this::report, millis, millis, TimeUnit.MILLISECONDS);
        this.scheduler = executor;
    }

    void report() {
        log.info(
                "{} requests queued, {} results queued, {} outstanding, {} persisted, {} blank, {} failed",
                tasks.size(),
                results.size(),
                outstanding.get(),
                stats.getPersisted(),
                stats.getBlank(),
                stats.getFailed());
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
