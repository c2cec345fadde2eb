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

/**
 * Spherical Mercator math relating longitude/latitude to quadtree tile ordinates.
 */
final class WebMercatorTiles {

    /** Latitude at which the Web Mercator square ends, {@code atan(sinh(PI))} in degrees. */
    static final double MAX_LATITUDE = 85.0511287798066;

    private WebMercatorTiles() {
        // Prevent instantiation
    }

    static BoundingBox2D geographicBounds(TileIndex tile) {
        final double n = 1L << tile.z();
        double minLon = tile.x() / n * 360.0 - 180.0;
        double maxLon = (tile.x() + 1) / n * 360.0 - 180.0;
        double maxLat = latitude(tile.y() / n);
        double minLat = latitude((tile.y() + 1) / n);
        return BoundingBox2D.geographic(minLon, minLat, maxLon, maxLat);
    }

    private static double latitude(double normalizedY) {
        return Math.toDegrees(Math.atan(Math.sinh(Math.PI * (1 - 2 * normalizedY))));
    }

    static int column(double lon, int z) {
        final int dim = 1 << z;
        int x = (int) Math.floor((lon + 180.0) / 360.0 * dim);
        return clamp(x, dim);
    }

    static int row(double lat, int z) {
        final int dim = 1 << z;
        double clamped = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lat));
        double radians = Math.toRadians(clamped);
        double normalized = (1 - Math.log(Math.tan(radians) + 1 / Math.cos(radians)) / Math.PI) / 2;
        return clamp((int) Math.floor(normalized * dim), dim);
    }

    private static int clamp(int ordinate, int dim) {
        return Math.max(0, Math.min(dim - 1, ordinate));
    }
}
