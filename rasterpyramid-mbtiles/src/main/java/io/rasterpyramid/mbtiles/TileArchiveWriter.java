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
package io.rasterpyramid.mbtiles;

import java.io.IOException;

/**
 * Single-writer sink for the tiles of a pyramid.
 * <p>
 * Implementations are not required to be thread-safe; a pyramid run funnels every write
 * through one thread.
 */
public interface TileArchiveWriter extends AutoCloseable {

    void writeMetadata(MBTilesMetadata metadata) throws IOException;

    /**
     * Stores a tile, replacing any tile previously stored at the same coordinates.
     */
    void write(TileRecord tile) throws IOException;

    /**
     * Makes all writes so far durable.
     */
    void commit() throws IOException;

    /**
     * @return the number of {@link #write} calls accepted so far, minus those lost to a failed
     *     transaction
     */
    long tilesWritten();

    /**
     * Commits pending writes and releases the archive.
     */
    @Override
    void close() throws IOException;
}
