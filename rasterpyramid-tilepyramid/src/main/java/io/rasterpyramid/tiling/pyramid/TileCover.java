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
import io.rasterpyramid.tiling.common.CRS;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.NullMarked;

/**
 * Computes the set of tiles at a given zoom level covering a geographic extent.
 */
@NullMarked
public final class TileCover {

    private TileCover() {
        // Prevent instantiation
    }

    /**
     * Returns the tiles at {@code zoom} intersecting {@code extent}.
     * <p>
     * The cover spans from the tile containing the north-west corner to the tile containing
     * the south-east corner, inclusive. Latitudes beyond the Web Mercator limit are clamped.
     * Tiles are returned in row-major order.
     *
     * @param extent a longitude/latitude extent
     * @param zoom   the zoom level of the cover
     * @return the covering tiles, never empty
     * @throws IllegalArgumentException if {@code extent} is not geographic, the zoom is invalid or the cover
     *     has more than {@link Integer#MAX_VALUE} tiles
     */
    public static List<TileIndex> cover(BoundingBox2D extent, int zoom) {
        if (!extent.crs().equals(CRS.WGS84)) {
            throw new IllegalArgumentException("Expected a " + CRS.WGS84.uri() + " extent, got " + extent.crs());
        }
        if (zoom < 0 || zoom > TileIndex.MAX_ZOOM) {
            throw new IllegalArgumentException("Invalid zoom level: " + zoom);
        }
        final int minX = WebMercatorTiles.column(extent.minX(), zoom);
        final int maxX = WebMercatorTiles.column(extent.maxX(), zoom);
        final int minY = WebMercatorTiles.row(extent.maxY(), zoom);
        final int maxY = WebMercatorTiles.row(extent.minY(), zoom);

        final long count = (long) (maxX - minX + 1) * (maxY - minY + 1);
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Extent " + extent + " covers " + count + " tiles at zoom " + zoom + ", more than can be listed");
        }
        List<TileIndex> tiles = new ArrayList<>((int) count);
        for (int y = minY; y <= maxY; y++) {
            for (int x = minX; x <= maxX; x++) {
                tiles.add(new TileIndex(zoom, x, y));
            }
        }
        return tiles;
    }
}
