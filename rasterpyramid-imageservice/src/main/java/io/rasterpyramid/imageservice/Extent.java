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
package io.rasterpyramid.imageservice;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.rasterpyramid.tiling.common.BoundingBox2D;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * An ArcGIS REST envelope, {@code {"xmin":..,"ymin":..,"xmax":..,"ymax":..,"spatialReference":{..}}}.
 */
@NullMarked
@JsonIgnoreProperties(ignoreUnknown = true)
public record Extent(
        @JsonProperty("xmin") double xMin,
        @JsonProperty("ymin") double yMin,
        @JsonProperty("xmax") double xMax,
        @JsonProperty("ymax") double yMax,
        @JsonProperty("spatialReference") @Nullable SpatialReference spatialReference) {

    public static Extent of(BoundingBox2D bbox) {
        return new Extent(bbox.minX(), bbox.minY(), bbox.maxX(), bbox.maxY(), SpatialReference.of(bbox.crs()));
    }

    /**
     * @throws ImageServiceException if the envelope carries no spatial reference
     */
    public BoundingBox2D toBoundingBox() throws ImageServiceException {
        if (spatialReference == null) {
            throw new ImageServiceException("Extent has no spatial reference: " + this);
        }
        try {
            return new BoundingBox2D(xMin, yMin, xMax, yMax, spatialReference.toCRS());
        } catch (IllegalArgumentException e) {
            throw new ImageServiceException("Invalid extent: " + this, e);
        }
    }
}
