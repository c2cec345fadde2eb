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
package io.rasterpyramid.tiling.common;

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.NullMarked;

/**
 * Axis aligned rectangle in the coordinates of a given {@link CRS}.
 * <p>
 * Used both for the whole extent of an image service and for the bounds of a single tile
 * in an export request.
 *
 * @param minX the minimum x (or longitude) ordinate
 * @param minY the minimum y (or latitude) ordinate
 * @param maxX the maximum x (or longitude) ordinate
 * @param maxY the maximum y (or latitude) ordinate
 * @param crs  the coordinate reference system of the ordinates
 */
@NullMarked
public record BoundingBox2D(double minX, double minY, double maxX, double maxY, CRS crs) {

    public BoundingBox2D {
        requireNonNull(crs, "crs");
        if (Double.isNaN(minX) || Double.isNaN(minY) || Double.isNaN(maxX) || Double.isNaN(maxY)) {
            throw new IllegalArgumentException("NaN ordinate in bounding box");
        }
        if (minX > maxX) {
            throw new IllegalArgumentException("minX > maxX: " + minX + " > " + maxX);
        }
        if (minY > maxY) {
            throw new IllegalArgumentException("minY > maxY: " + minY + " > " + maxY);
        }
    }

    public static BoundingBox2D geographic(double minLon, double minLat, double maxLon, double maxLat) {
        return new BoundingBox2D(minLon, minLat, maxLon, maxLat, CRS.WGS84);
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    @Override
    public String toString() {
        return "BoundingBox2D[%f,%f,%f,%f %s]".formatted(minX, minY, maxX, maxY, crs.uri());
    }
}
