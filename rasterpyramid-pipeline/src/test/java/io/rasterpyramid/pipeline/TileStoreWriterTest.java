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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class TileStoreWriterTest {

    private static final int MAX_ZOOM = 5;

    private PipelineQueue<FetchResult> results;
    private PipelineQueue<FetchTask> tasks;
    private OutstandingWork outstanding;
    private PyramidStats stats;
    private RecordingArchive archive;
    private TileStoreWriter writer;

    @BeforeEach
    void setUp() {
        results = PipelineQueue.unbounded("results");
        tasks = PipelineQueue.unbounded("requests");
        outstanding = new OutstandingWork(() -> {
            tasks.close();
            results.close();
        });
        stats = new PyramidStats();
        archive = new RecordingArchive();
        writer = new TileStoreWriter(
                results, tasks, outstanding, archive, new ByteLengthBlankTileClassifier(), MAX_ZOOM, stats);
    }

    private List<TileIndex> queuedTasks() throws InterruptedException {
        List<TileIndex> queued = new ArrayList<>();
        while (tasks.size() > 0) {
            Optional<FetchTask> task = tasks.take();
            task.ifPresent(t -> queued.add(t.tile()));
        }
        return queued;
    }

    @Test
    void testStoredTileRequestsItsChildren() throws Exception {
        TileIndex tile = TileIndex.xyz(3, 5, 4);
        outstanding.increment();
        writer.process(FetchResult.success(tile, new byte[100], 1));

        assertThat(archive.tiles()).containsExactly(tile);
        assertThat(queuedTasks()).containsExactlyElementsOf(tile.children());
        assertThat(outstanding.get()).isEqualTo(4);
        assertThat(stats.getEnqueued()).isEqualTo(4);
        assertThat(stats.getPersisted(4)).isOne();
    }

    @Test
    void testTileAtMaxZoomHasNoChildren() throws Exception {
        outstanding.increment();
        writer.process(FetchResult.success(TileIndex.xyz(3, 5, MAX_ZOOM), new byte[100], 1));

        assertThat(archive.records).hasSize(1);
        assertThat(tasks.size()).isZero();
        assertThat(outstanding.isComplete()).isTrue();
        assertThat(tasks.isClosed()).isTrue();
        assertThat(results.isClosed()).isTrue();
    }

    @Test
    void testBlankTileIsSkipped() throws Exception {
        outstanding.increment();
        outstanding.increment();
        writer.process(FetchResult.success(TileIndex.xyz(0, 0, 1), new byte[777], 1));

        assertThat(archive.records).isEmpty();
        assertThat(tasks.size()).isZero();
        assertThat(stats.getBlank()).isOne();
        assertThat(outstanding.get()).isOne();
    }

    @Test
    void testFailedFetchIsSkipped() throws Exception {
        outstanding.increment();
        outstanding.increment();
        writer.process(FetchResult.failed(TileIndex.xyz(0, 0, 1), new IOException("HTTP 500"), 3));

        assertThat(archive.records).isEmpty();
        assertThat(tasks.size()).isZero();
        assertThat(stats.getFailed()).isOne();
        assertThat(outstanding.get()).isOne();
    }

    @Test
    void testDrainCommitsOnceResultsAreClosed() throws Exception {
        outstanding.increment();
        results.put(FetchResult.success(TileIndex.xyz(1, 1, MAX_ZOOM), new byte[100], 1));

        writer.drain();

        assertThat(archive.records).hasSize(1);
        assertThat(archive.commits).isOne();
        assertThat(outstanding.isComplete()).isTrue();
    }

    @Test
    void testArchiveFailurePropagates() throws Exception {
        TileIndex tile = TileIndex.xyz(1, 1, 2);
        archive = new RecordingArchive(tile::equals);
        writer = new TileStoreWriter(
                results, tasks, outstanding, archive, new ByteLengthBlankTileClassifier(), MAX_ZOOM, stats);
        outstanding.increment();
        results.put(FetchResult.success(tile, new byte[100], 1));

        assertThatThrownBy(writer::drain).isInstanceOf(IOException.class).hasMessageContaining("disk full");
        assertThat(tasks.size()).isZero();
        assertThat(archive.commits).isZero();
    }
}
