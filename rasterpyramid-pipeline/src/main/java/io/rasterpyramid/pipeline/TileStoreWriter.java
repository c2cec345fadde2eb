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

import io.rasterpyramid.mbtiles.TileArchiveWriter;
import io.rasterpyramid.mbtiles.TileRecord;
import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.util.Optional;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single consumer of fetch results.
 * <p>
 * For each result it either drops the tile (failed fetch or blank image), or stores it in the
 * archive and, below the maximum zoom level, enqueues fetch tasks for the tile's four children.
 * A tile is only subdivided if it was stored, so blank areas are never explored deeper.
 * <p>
 * The unit of {@link OutstandingWork} of a result is released only after its children were
 * counted.
 */
@NullMarked
class TileStoreWriter {

    private static final Logger log = LoggerFactory.getLogger(TileStoreWriter.class);

    private final PipelineQueue<FetchResult> results;
    private final PipelineQueue<FetchTask> tasks;
    private final OutstandingWork outstanding;
    private final TileArchiveWriter archive;
    private final BlankTileClassifier blankClassifier;
    private final int maxZoom;
    private final PyramidStats stats;

    TileStoreWriter(
            PipelineQueue<FetchResult> results,
            PipelineQueue<FetchTask> tasks,
            OutstandingWork outstanding,
            TileArchiveWriter archive,
            BlankTileClassifier blankClassifier,
            int maxZoom,
            PyramidStats stats) {
        this.results = requireNonNull(results);
        this.tasks = requireNonNull(tasks);
        this.outstanding = requireNonNull(outstanding);
        this.archive = requireNonNull(archive);
        this.blankClassifier = requireNonNull(blankClassifier);
        this.maxZoom = maxZoom;
        this.stats = requireNonNull(stats);
    }

    /**
     * Processes results until the result queue is closed and drained, then commits the archive.
     *
     * @throws IOException if the archive fails to store a tile
     */
    void drain() throws IOException, InterruptedException {
        Optional<FetchResult> next;
        while ((next = results.take()).isPresent()) {
            process(next.get());
        }
        archive.commit();
        log.debug("Result queue drained, {} tiles written", archive.tilesWritten());
    }

    void process(FetchResult result) throws IOException, InterruptedException {
        final TileIndex tile = result.tile();
        if (result.isFailed()) {
            stats.failed();
        } else {
            byte[] data = result.requireData();
            if (blankClassifier.isBlank(tile, data)) {
                log.trace("Skipping blank tile {}", tile);
                stats.blank();
            } else {
                archive.write(TileRecord.of(tile, data));
                stats.persisted(tile.z());
                if (tile.z() < maxZoom) {
                    for (TileIndex child : tile.children()) {
                        enqueue(child);
                    }
                }
            }
        }
        outstanding.done();
    }

    private void enqueue(TileIndex tile) throws InterruptedException {
        outstanding.increment();
        stats.enqueued();
        tasks.put(new FetchTask(tile));
    }
}
