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

import io.rasterpyramid.tiling.common.BoundingBox2D;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Rows of the MBTiles {@code metadata} table written for a raster pyramid.
 * <p>
 * Rows are always in the {@code tms} scheme, see {@link TileRecord}.
 *
 * @param name        the tileset name
 * @param format      the tile image format, e.g. {@code png}
 * @param minZoom     the shallowest zoom level
 * @param maxZoom     the deepest zoom level
 * @param bounds      the longitude/latitude extent of the tileset, if known
 * @param description optional human readable description
 * @param type        {@code overlay} or {@code baselayer}
 */
@NullMarked
public record MBTilesMetadata(
        String name,
        String format,
        int minZoom,
        int maxZoom,
        @Nullable BoundingBox2D bounds,
        @Nullable String description,
        String type) {

    public static final String SCHEME = "tms";

    public MBTilesMetadata {
        requireNonNull(name, "name");
        requireNonNull(format, "format");
        requireNonNull(type, "type");
        if (minZoom < 0 || minZoom > maxZoom) {
            throw new IllegalArgumentException("Invalid zoom range: %d-%d".formatted(minZoom, maxZoom));
        }
    }

    public static MBTilesMetadata of(String name, String format, int minZoom, int maxZoom) {
        return new MBTilesMetadata(name, format, minZoom, maxZoom, null, null, "overlay");
    }

    public MBTilesMetadata withBounds(@Nullable BoundingBox2D bounds) {
        return new MBTilesMetadata(name, format, minZoom, maxZoom, bounds, description, type);
    }

    public MBTilesMetadata withDescription(@Nullable String description) {
        return new MBTilesMetadata(name, format, minZoom, maxZoom, bounds, description, type);
    }

    /**
     * @return the {@code name -> value} rows, in insertion order
     */
    public Map<String, String> toMap() {
        Map<String, String> rows = new LinkedHashMap<>();
        rows.put("name", name);
        rows.put("format", format);
        rows.put("minzoom", String.valueOf(minZoom));
        rows.put("maxzoom", String.valueOf(maxZoom));
        rows.put("scheme", SCHEME);
        rows.put("type", type);
        if (bounds != null) {
            rows.put("bounds", "%s,%s,%s,%s".formatted(bounds.minX(), bounds.minY(), bounds.maxX(), bounds.maxY()));
        }
        if (description != null) {
            rows.put("description", description);
        }
        return rows;
    }
}
