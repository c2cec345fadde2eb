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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Coordinate Reference System representation supporting both URI and WKT formats.
 * <p>
 * Image services identify spatial references by EPSG code ({@code wkid}), so this record
 * offers {@link #ofEPSG(int)} and {@link #epsgCode()} to move between the two forms.
 *
 * @param uri the CRS URI identifier (e.g., "EPSG:4326")
 * @param wkt the Well-Known Text representation of the CRS
 */
@NullMarked
public record CRS(@Nullable String uri, @Nullable String wkt) {

    private static final String EPSG_PREFIX = "EPSG:";

    /** Geographic longitude/latitude on the WGS84 datum. */
    public static final CRS WGS84 = ofEPSG(4326);

    /** Spherical Web Mercator, the projection of the tile pyramid's images. */
    public static final CRS WEB_MERCATOR = ofEPSG(3857);

    /**
     * Creates a CRS from a URI identifier.
     *
     * @param uri the CRS URI identifier
     * @return a new CRS with the specified URI
     */
    public static CRS ofURI(String uri) {
        return new CRS(uri, null);
    }

    /**
     * Creates a CRS from a Well-Known Text representation.
     *
     * @param wkt the WKT string
     * @return a new CRS with the specified WKT
     */
    public static CRS ofWKT(String wkt) {
        return new CRS(null, wkt);
    }

    /**
     * Creates a CRS from an EPSG code, as reported in an image service's {@code wkid}.
     *
     * @param code the EPSG code
     * @return a new CRS with the {@code EPSG:<code>} URI
     */
    public static CRS ofEPSG(int code) {
        if (code <= 0) {
            throw new IllegalArgumentException("EPSG code must be positive: " + code);
        }
        return ofURI(EPSG_PREFIX + code);
    }

    /**
     * @return the EPSG code of this CRS
     * @throws IllegalStateException if this CRS is not identified by an {@code EPSG:<code>} URI
     */
    public int epsgCode() {
        if (uri == null || !uri.regionMatches(true, 0, EPSG_PREFIX, 0, EPSG_PREFIX.length())) {
            throw new IllegalStateException("Not an EPSG identified CRS: " + this);
        }
        try {
            return Integer.parseInt(uri.substring(EPSG_PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid EPSG code in " + uri, e);
        }
    }

    public boolean isEPSG(int code) {
        return uri != null && uri.equalsIgnoreCase(EPSG_PREFIX + code);
    }
}
