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
package io.rasterpyramid.tiling.pyramid;

import io.rasterpyramid.tiling.common.BoundingBox2D;
import java.util.List;
import org.jspecify.annotations.NullMarked;

/**
 * Identity of a tile in the Web Mercator quadtree.
 * <p>
 * Zoom level {@code 0} is a single tile covering the whole world, and every tile at zoom
 * {@code z} has exactly four {@link #children() children} at zoom {@code z + 1}. The
 * {@code y} ordinate follows the XYZ convention, with row {@code 0} at the northern edge;
 * use {@link #tmsRow()} to obtain the inverted (TMS) row stored in MBTiles.
 *
 * @param z the zoom level
 * @param x the column, {@code 0 <= x < 2^z}
 * @param y the row counted from the north, {@code 0 <= y < 2^z}
 */
@NullMarked
public record TileIndex(int z, int x, int y) {

    /** Deepest zoom level whose tile ordinates fit in an {@code int}. */
    public static final int MAX_ZOOM = 30;

    public TileIndex {
        if (z < 0 || z > MAX_ZOOM) {
            throw new IllegalArgumentException("z must be between 0 and " + MAX_ZOOM + ", got " + z);
        }
        final int dim = 1 << z;
        if (x < 0 || x >= dim) {
            throw new IllegalArgumentException("x out of range for z%d: %d".formatted(z, x));
        }
        if (y < 0 || y >= dim) {
            throw new IllegalArgumentException("y out of range for z%d: %d".formatted(z, y));
        }
    }

    public static TileIndex xyz(int x, int y, int z) {
        return new TileIndex(z, x, y);
    }

    /**
     * Creates a tile index from MBTiles coordinates, where rows are counted from the south.
     */
    public static TileIndex fromTmsRow(int z, int column, int tmsRow) {
        return new TileIndex(z, column, flipRow(z, tmsRow));
    }

    /**
     * Converts between XYZ and TMS rows; the conversion is its own inverse.
     *
     * @return {@code 2^z - 1 - row}
     */
    public static int flipRow(int z, int row) {
        return (1 << z) - 1 - row;
    }

    public int tmsRow() {
        return flipRow(z, y);
    }

    /**
     * @return the four tiles at {@code z + 1} covering this tile's quadrants, in
     *         NW, NE, SW, SE order
     */
    public List<TileIndex> children() {
        if (z == MAX_ZOOM) {
            throw new IllegalStateException("Tile at max zoom has no children: " + this);
        }
        final int cz = z + 1;
        final int cx = x << 1;
        final int cy = y << 1;
        return List.of(
                new TileIndex(cz, cx, cy),
                new TileIndex(cz, cx + 1, cy),
                new TileIndex(cz, cx, cy + 1),
                new TileIndex(cz, cx + 1, cy + 1));
    }

    public TileIndex parent() {
        if (z == 0) {
            throw new IllegalStateException("Root tile has no parent");
        }
        return new TileIndex(z - 1, x >> 1, y >> 1);
    }

    /**
     * @return the longitude/latitude bounds of this tile
     */
    public BoundingBox2D geographicBounds() {
        return WebMercatorTiles.geographicBounds(this);
    }

    @Override
    public String toString() {
        return "%d/%d/%d".formatted(z, x, y);
    }
}
