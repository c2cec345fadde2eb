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
package io.rasterpyramid.pipeline;

import static java.util.Objects.requireNonNull;

import io.rasterpyramid.imageservice.ExportImageRequest;
import io.rasterpyramid.imageservice.ExportImageResponse;
import io.rasterpyramid.imageservice.ImageServiceClient;
import io.rasterpyramid.imageservice.ImageSize;
import io.rasterpyramid.tiling.common.CRS;
import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.NullMarked;

/**
 * {@link TileFetcher} rendering each tile through an image service's {@code exportImage} operation.
 * <p>
 * Each tile is requested as a 256x256 {@code U8} Web Mercator image of its longitude/latitude
 * bounds, with the configured no-data values (by default {@code 255}) rendered transparent. Both
 * round trips (export and image download) share a single deadline, so a slow export leaves less
 * time for the download.
 */
@NullMarked
public class ImageServiceTileFetcher implements TileFetcher {

    private final ImageServiceClient client;

    private final Duration deadline;

    private final String format;

    private final boolean inline;

    private final List<Integer> noData;

    public ImageServiceTileFetcher(ImageServiceClient client, PyramidConfig config) {
        this(client, config.requestTimeout(), config.format(), config.inlineExport(), config.noData());
    }

    public ImageServiceTileFetcher(ImageServiceClient client, Duration deadline, String format, boolean inline) {
        this(client, deadline, format, inline, PyramidConfig.DEFAULT_NO_DATA);
    }

    public ImageServiceTileFetcher(
            ImageServiceClient client, Duration deadline, String format, boolean inline, List<Integer> noData) {
        this.client = requireNonNull(client, "client");
        this.deadline = requireNonNull(deadline, "deadline");
        this.format = requireNonNull(format, "format");
        this.inline = inline;
        this.noData = List.copyOf(noData);
    }

    ExportImageRequest exportRequest(TileIndex tile) {
        return ExportImageRequest.builder()
                .bbox(tile.geographicBounds())
                .size(ImageSize.TILE_256)
                .imageSR(CRS.WEB_MERCATOR)
                .format(format)
                .pixelType("U8")
                .noData(noData)
                .build();
    }

    @Override
    public byte[] fetch(TileIndex tile) throws IOException {
        final long deadlineNanos = System.nanoTime() + deadline.toNanos();
        ExportImageRequest request = exportRequest(tile);
        if (inline) {
            return client.exportImageBytes(request, remaining(deadlineNanos, tile));
        }
        ExportImageResponse exported = client.exportImage(request, remaining(deadlineNanos, tile));
        return client.fetchImage(exported, remaining(deadlineNanos, tile));
    }

    private static Duration remaining(long deadlineNanos, TileIndex tile) throws HttpTimeoutException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new HttpTimeoutException("Deadline exceeded fetching tile " + tile);
        }
        return Duration.ofNanos(remaining);
    }
}
