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
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of an ArcGIS {@code exportImage} operation.
 *
 * @param bbox      the area to render; its CRS is sent as {@code bboxSR}
 * @param size      the output image size in pixels
 * @param imageSR   the spatial reference of the rendered image
 * @param format    the image format, one of {@code jpgpng, png, png8, png24, png32, jpg, bmp, gif, tiff}
 * @param pixelType the pixel representation, e.g. {@code U8}, {@code F32}
 * @param noData    pixel values to render as no data (transparent)
 */
@NullMarked
public record ExportImageRequest(
        BoundingBox2D bbox, ImageSize size, CRS imageSR, String format, String pixelType, List<Integer> noData) {

    public ExportImageRequest {
        requireNonNull(bbox, "bbox");
        requireNonNull(size, "size");
        requireNonNull(imageSR, "imageSR");
        requireNonNull(format, "format");
        requireNonNull(pixelType, "pixelType");
        noData = List.copyOf(noData);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param responseFormat the {@code f} parameter, {@code pjson} for a JSON description with an
     *                       {@code href}, or {@code image} for the image bytes
     * @return the query parameters, in a stable order
     */
    Map<String, String> toQueryParameters(String responseFormat) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("f", responseFormat);
        params.put(
                "bbox",
                String.join(
                        ",",
                        plain(bbox.minX()),
                        plain(bbox.minY()),
                        plain(bbox.maxX()),
                        plain(bbox.maxY())));
        params.put("bboxSR", String.valueOf(bbox.crs().epsgCode()));
        params.put("size", size.toQueryValue());
        params.put("imageSR", String.valueOf(imageSR.epsgCode()));
        params.put("format", format);
        params.put("pixelType", pixelType);
        if (!noData.isEmpty()) {
            params.put("noData", noData.stream().map(String::valueOf).collect(Collectors.joining(",")));
        }
        return params;
    }

    // avoids scientific notation, which the services reject
    private static String plain(double ordinate) {
        return BigDecimal.valueOf(ordinate).toPlainString();
    }

    public static class Builder {
        @Nullable
        private BoundingBox2D bbox;
        private ImageSize size = ImageSize.TILE_256;
        private CRS imageSR = CRS.WEB_MERCATOR;
        private String format = "png";
        private String pixelType = "U8";
        private List<Integer> noData = List.of();

        public Builder bbox(BoundingBox2D bbox) {
            this.bbox = bbox;
            return this;
        }

        public Builder size(ImageSize size) {
            this.size = size;
            return this;
        }

        public Builder imageSR(CRS imageSR) {
            this.imageSR = imageSR;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder pixelType(String pixelType) {
            this.pixelType = pixelType;
            return this;
        }

        public Builder noData(List<Integer> noData) {
            this.noData = noData;
            return this;
        }

        public ExportImageRequest build() {
            return new ExportImageRequest(bbox, size, imageSR, format, pixelType, noData);
        }
    }
}
