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

import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters of a pyramid run, updated concurrently by the workers and the writer.
 */
public class PyramidStats {

    private final LongAdder baseTiles = new LongAdder();
    private final LongAdder enqueued = new LongAdder();
    private final LongAdder fetched = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder blank = new LongAdder();
    private final AtomicLongArray persistedByZoom = new AtomicLongArray(TileIndex.MAX_ZOOM + 1);

    void baseTiles(int count) {
        baseTiles.add(count);
    }

    void enqueued() {
        enqueued.increment();
    }

    void fetched() {
        fetched.increment();
    }

    void retried() {
        retries.increment();
    }

    void failed() {
        failed.increment();
    }

    void blank() {
        blank.increment();
    }

    void persisted(int zoom) {
        persistedByZoom.incrementAndGet(zoom);
    }

    public long getBaseTiles() {
        return baseTiles.sum();
    }

    /** @return the number of fetch tasks enqueued, base tiles included */
    public long getEnqueued() {
        return enqueued.sum();
    }

    /** @return the number of tiles fetched successfully */
    public long getFetched() {
        return fetched.sum();
    }

    /** @return the number of fetch attempts that were retried */
    public long getRetries() {
        return retries.sum();
    }

    /** @return the number of tiles dropped after exhausting their fetch attempts */
    public long getFailed() {
        return failed.sum();
    }

    public long getBlank() {
        return blank.sum();
    }

    public long getPersisted() {
        long total = 0;
        for (int z = 0; z < persistedByZoom.length(); z++) {
            total += persistedByZoom.get(z);
        }
        return total;
    }

    public long getPersisted(int zoom) {
        return persistedByZoom.get(zoom);
    }

    /**
     * @return persisted tile counts of the zoom levels that have any
     */
    public Map<Integer, Long> getPersistedByZoom() {
        Map<Integer, Long> counts = new LinkedHashMap<>();
        for (int z = 0; z < persistedByZoom.length(); z++) {
            long count = persistedByZoom.get(z);
            if (count > 0) {
                counts.put(z, count);
            }
        }
        return counts;
    }

    @Override
    public String toString() {
        return "PyramidStats[base=%,d, enqueued=%,d, fetched=%,d, retries=%,d, failed=%,d, blank=%,d, persisted=%,d]"
                .formatted(
                        getBaseTiles(),
                        getEnqueued(),
                        getFetched(),
                        getRetries(),
                        getFailed(),
                        getBlank(),
                        getPersisted());
    }
}
