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

import static java.util.Objects.requireNonNull;

import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.util.Arrays;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * A tile as stored in an MBTiles {@code tiles} table, with its row in the TMS convention
 * (row {@code 0} at the southern edge).
 *
 * @param zoom   the {@code zoom_level}
 * @param column the {@code tile_column}
 * @param row    the {@code tile_row}, counted from the south
 * @param data   the encoded image, stored as is
 */
@NullMarked
public record TileRecord(int zoom, int column, int row, byte[] data) {

    public TileRecord {
        requireNonNull(data, "data");
    }

    /**
     * Creates the record for an XYZ addressed tile, inverting its row.
     */
    public static TileRecord of(TileIndex tile, byte[] data) {
        return new TileRecord(tile.z(), tile.x(), tile.tmsRow(), data);
    }

    public TileIndex tileIndex() {
        return TileIndex.fromTmsRow(zoom, column, row);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TileRecord r
                && zoom == r.zoom
                && column == r.column
                && row == r.row
                && Arrays.equals(data, r.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * zoom + column) + row) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "TileRecord[%d/%d/%d, %,d bytes]".formatted(zoom, column, row, data.length);
    }
}
