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

import static java.util.Objects.requireNonNull;

import io.rasterpyramid.tiling.common.BoundingBox2D;
import io.rasterpyramid.tiling.common.CRS;
import java.io.IOException;
import java.time.Duration;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the longitude/latitude extent covered by an image service.
 * <p>
 * Services report their {@code fullExtent} in their native spatial reference. When that is
 * not EPSG:4326, the service itself is asked to reproject it: a low resolution export of the
 * full extent with {@code imageSR=4326} reports the geographic extent of the rendered image.
 */
@NullMarked
public class ExtentResolver {

    private static final Logger log = LoggerFactory.getLogger(ExtentResolver.class);

    private final ImageServiceClient client;

    private final Duration timeout;

    public ExtentResolver(ImageServiceClient client, Duration timeout) {
        this.client = requireNonNull(client);
        this.timeout = requireNonNull(timeout);
    }

    /**
     * @return the service's full extent in {@link CRS#WGS84}
     * @throws IOException if the service can't be queried or reports no usable extent
     */
    public BoundingBox2D resolveGeographicExtent() throws IOException {
        ServiceInfo info = client.getServiceInfo(timeout);
        Extent fullExtent = info.fullExtent() != null ? info.fullExtent() : info.extent();
        if (fullExtent == null) {
            throw new ImageServiceException("Service reports no fullExtent: " + client.getEndpoint());
        }
        BoundingBox2D nativeExtent = fullExtent.toBoundingBox();
        log.info("Service full extent: {}", nativeExtent);
        if (CRS.WGS84.equals(nativeExtent.crs())) {
            return nativeExtent;
        }

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(nativeExtent)
                .size(ImageSize.TILE_512)
                .imageSR(CRS.WGS84)
                .format("png")
                .pixelType("U8")
                .build();
        ExportImageResponse response = client.exportImage(request, timeout);
        if (response.extent() == null) {
            throw new ImageServiceException("exportImage response has no extent: " + client.getEndpoint());
        }
        BoundingBox2D geographic = response.extent().toBoundingBox();
        if (!CRS.WGS84.equals(geographic.crs())) {
            throw new ImageServiceException("Service did not reproject its extent to EPSG:4326: " + geographic);
        }
        log.info(
                "Extent of 4326 image: {},{},{},{}",
                geographic.minX(),
                geographic.minY(),
                geographic.maxX(),
                geographic.maxY());
        return geographic;
    }
}
