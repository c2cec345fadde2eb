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
import com.fasterxml.jackson.annotation.JsonInclude;
import io.rasterpyramid.tiling.common.CRS;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Spatial reference as encoded by ArcGIS REST services.
 * <p>
 * Services may report a legacy ESRI {@code wkid} (e.g. {@code 102100}) along with the
 * equivalent EPSG {@code latestWkid} (e.g. {@code 3857}); {@link #toCRS()} prefers the latter.
 */
@NullMarked
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpatialReference(int wkid, @Nullable Integer latestWkid) {

    public static SpatialReference of(int wkid) {
        return new SpatialReference(wkid, null);
    }

    public static SpatialReference of(CRS crs) {
        return of(crs.epsgCode());
    }

    public int effectiveWkid() {
        return latestWkid != null && latestWkid > 0 ? latestWkid : wkid;
    }

    public CRS toCRS() {
        return CRS.ofEPSG(effectiveWkid());
    }
}
