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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.rasterpyramid.imageservice.ExportImageRequest;
import io.rasterpyramid.imageservice.ImageServiceClient;
import io.rasterpyramid.imageservice.ImageServiceException;
import io.rasterpyramid.tiling.common.CRS;
import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class ImageServiceTileFetcherTest {

    private static final String SERVICE_PATH = "/arcgis/rest/services/Ortho/ImageServer";

    private static final String IMAGE_PATH = "/arcgis/rest/directories/arcgisoutput/tile_1.png";

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 13, 10, 26, 10};

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private ImageServiceClient client;

    private final TileIndex tile = TileIndex.xyz(0, 0, 1);

    @BeforeEach
    void setUp() {
        client = ImageServiceClient.builder().endpoint(wm.baseUrl() + SERVICE_PATH).build();
    }

    private void stubExport() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("f", equalTo("pjson"))
                .willReturn(okJson(
                        """
                        {"href": "%s", "width": 256, "height": 256,
                         "extent": {"xmin": -20037508.34, "ymin": 0, "xmax": 0, "ymax": 20037508.34,
                                    "spatialReference": {"wkid": 102100, "latestWkid": 3857}}}
                        """
                                .formatted(IMAGE_PATH))));
    }

    @Test
    void testExportRequestForTile() {
        ImageServiceTileFetcher fetcher = new ImageServiceTileFetcher(client, Duration.ofSeconds(5), "png", false);

        ExportImageRequest request = fetcher.exportRequest(tile);

        assertThat(request.bbox()).isEqualTo(tile.geographicBounds());
        assertThat(request.imageSR()).isEqualTo(CRS.WEB_MERCATOR);
        assertThat(request.size().width()).isEqualTo(256);
        assertThat(request.format()).isEqualTo("png");
        assertThat(request.pixelType()).isEqualTo("U8");
        assertThat(request.noData()).containsExactly(255);
    }

    @Test
    void testFetchExportsThenDownloads() throws IOException {
        stubExport();
        wm.stubFor(get(urlPathEqualTo(IMAGE_PATH))
                .willReturn(aResponse().withHeader("Content-Type", "image/png").withBody(PNG)));
        ImageServiceTileFetcher fetcher = new ImageServiceTileFetcher(client, Duration.ofSeconds(5), "png", false);

        assertThat(fetcher.fetch(tile)).isEqualTo(PNG);

        wm.verify(getRequestedFor(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("bbox", matching("-180\\.0,0\\.0,0\\.0,85\\.0511\\d*"))
                .withQueryParam("bboxSR", equalTo("4326"))
                .withQueryParam("imageSR", equalTo("3857"))
                .withQueryParam("size", equalTo("256,256"))
                .withQueryParam("pixelType", equalTo("U8"))
                .withQueryParam("noData", equalTo("255")));
        wm.verify(getRequestedFor(urlPathEqualTo(IMAGE_PATH)));
    }

    @Test
    void testInlineFetch() throws IOException {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("f", equalTo("image"))
                .willReturn(aResponse().withHeader("Content-Type", "image/png").withBody(PNG)));
        ImageServiceTileFetcher fetcher = new ImageServiceTileFetcher(client, Duration.ofSeconds(5), "png", true);

        assertThat(fetcher.fetch(tile)).isEqualTo(PNG);
    }

    @Test
    void testImageDownloadFailure() {
        stubExport();
        wm.stubFor(get(urlPathEqualTo(IMAGE_PATH)).willReturn(aResponse().withStatus(404)));
        ImageServiceTileFetcher fetcher = new ImageServiceTileFetcher(client, Duration.ofSeconds(5), "png", false);

        assertThatThrownBy(() -> fetcher.fetch(tile))
                .isInstanceOf(ImageServiceException.class)
                .hasFieldOrPropertyWithValue("code", 404);
    }

    @Test
    void testDeadlineCoversBothRequests() {
        stubExport();
        wm.stubFor(get(urlPathEqualTo(IMAGE_PATH))
                .willReturn(aResponse().withFixedDelay(2_000).withBody(PNG)));
        ImageServiceTileFetcher fetcher =
                new ImageServiceTileFetcher(client, Duration.ofMillis(500), "png", false);

        assertThatThrownBy(() -> fetcher.fetch(tile)).isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void testDeadlineCoversSlowImageBody() {
        stubExport();
        wm.stubFor(get(urlPathEqualTo(IMAGE_PATH))
                .willReturn(aResponse()
                        .withHeader("Content-Type", "image/png")
                        .withBody(new byte[4096])
                        .withChunkedDribbleDelay(20, 6_000)));
        ImageServiceTileFetcher fetcher =
                new ImageServiceTileFetcher(client, Duration.ofMillis(1_000), "png", false);

        long start = System.nanoTime();
        assertThatThrownBy(() -> fetcher.fetch(tile)).isInstanceOf(HttpTimeoutException.class);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMillis).isLessThan(4_000);
    }

    @Test
    void testConfiguredNoData() throws IOException {
        stubExport();
        wm.stubFor(get(urlPathEqualTo(IMAGE_PATH))
                .willReturn(aResponse().withHeader("Content-Type", "image/png").withBody(PNG)));
        PyramidConfig config = PyramidConfig.builder().noData(List.of(0, 254)).build();
        ImageServiceTileFetcher fetcher = new ImageServiceTileFetcher(client, config);

        assertThat(fetcher.exportRequest(tile).noData()).containsExactly(0, 254);
        fetcher.fetch(tile);

        wm.verify(getRequestedFor(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("noData", equalTo("0,254")));
    }

    @Test
    void testNoDataOmittedWhenEmpty() throws IOException {
        stubExport();
        wm.stubFor(get(urlPathEqualTo(IMAGE_PATH))
                .willReturn(aResponse().withHeader("Content-Type", "image/png").withBody(PNG)));
        ImageServiceTileFetcher fetcher =
                new ImageServiceTileFetcher(client, Duration.ofSeconds(5), "png", false, List.of());

        fetcher.fetch(tile);

        wm.verify(getRequestedFor(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withoutQueryParam("noData"));
    }
}
