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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.rasterpyramid.tiling.common.BoundingBox2D;
import io.rasterpyramid.tiling.common.CRS;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class ImageServiceClientTest {

    private static final String SERVICE_PATH = "/arcgis/rest/services/Ortho/ImageServer";

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private ImageServiceClient client;

    @BeforeEach
    void setUp() {
        client = ImageServiceClient.builder()
                .endpoint(wm.baseUrl() + SERVICE_PATH + "/")
                .build();
    }

    @Test
    void testEndpointTrailingSlashIsRemoved() {
        assertThat(client.getEndpoint().toString()).isEqualTo(wm.baseUrl() + SERVICE_PATH);
    }

    @Test
    void testUnsupportedScheme() {
        ImageServiceClient.Builder builder = ImageServiceClient.builder().endpoint("ftp://example.com/ImageServer");
        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testGetServiceInfo() throws IOException {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH))
                .withQueryParam("f", equalTo("json"))
                .willReturn(okJson(
                        """
                        {
                          "name": "Ortho",
                          "serviceDescription": "ignored",
                          "fullExtent": {
                            "xmin": -13433000.5, "ymin": 6530000.25, "xmax": -13410000, "ymax": 6560000,
                            "spatialReference": {"wkid": 102100, "latestWkid": 3857}
                          },
                          "initialExtent": {
                            "xmin": 1, "ymin": 2, "xmax": 3, "ymax": 4, "spatialReference": {"wkid": 4326}
                          }
                        }
                        """)));

        ServiceInfo info = client.getServiceInfo(TIMEOUT);

        assertThat(info.name()).isEqualTo("Ortho");
        assertThat(info.extent()).isNull();
        Extent full = info.fullExtent();
        assertThat(full).isNotNull();
        assertThat(full.xMin()).isEqualTo(-13433000.5);
        assertThat(full.yMin()).isEqualTo(6530000.25);
        assertThat(full.spatialReference().effectiveWkid()).isEqualTo(3857);
        assertThat(full.toBoundingBox().crs()).isEqualTo(CRS.WEB_MERCATOR);
        assertThat(info.initialExtent().toBoundingBox().crs()).isEqualTo(CRS.WGS84);
    }

    @Test
    void testExportImageSendsParametersAndFetchesRelativeHref() throws IOException {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .willReturn(okJson(
                        """
                        {"href": "/arcgis/rest/directories/arcgisoutput/img_123.png",
                         "width": 256, "height": 256, "scale": 0,
                         "extent": {"xmin": 0, "ymin": 0, "xmax": 1, "ymax": 1, "spatialReference": {"wkid": 3857}}}
                        """)));
        wm.stubFor(get(urlPathEqualTo("/arcgis/rest/directories/arcgisoutput/img_123.png"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "image/png").withBody(png)));

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(-120.5, 50.25, -120.25, 50.5))
                .size(ImageSize.TILE_256)
                .imageSR(CRS.WEB_MERCATOR)
                .format("png")
                .pixelType("U8")
                .noData(List.of(255))
                .build();

        ExportImageResponse response = client.exportImage(request, TIMEOUT);
        assertThat(response.width()).isEqualTo(256);
        assertThat(response.href()).endsWith("img_123.png");

        byte[] image = client.fetchImage(response, TIMEOUT);
        assertThat(image).isEqualTo(png);

        wm.verify(getRequestedFor(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("f", equalTo("pjson"))
                .withQueryParam("bbox", equalTo("-120.5,50.25,-120.25,50.5"))
                .withQueryParam("bboxSR", equalTo("4326"))
                .withQueryParam("size", equalTo("256,256"))
                .withQueryParam("imageSR", equalTo("3857"))
                .withQueryParam("format", equalTo("png"))
                .withQueryParam("pixelType", equalTo("U8"))
                .withQueryParam("noData", equalTo("255")));
    }

    @Test
    void testExportImageWithoutNoDataOmitsParameter() {
        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(0, 0, 0.0001, 0.0001))
                .build();

        String query = client.exportImageUri(request, "pjson").getRawQuery();

        assertThat(query).doesNotContain("noData").contains("bbox=0.0%2C0.0%2C0.00010%2C0.00010");
    }

    @Test
    void testServiceErrorDocument() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .willReturn(okJson("{\"error\": {\"code\": 400, \"message\": \"Invalid bbox\", \"details\": []}}")));

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(0, 0, 1, 1))
                .build();

        assertThatThrownBy(() -> client.exportImage(request, TIMEOUT))
                .isInstanceOf(ImageServiceException.class)
                .hasMessageContaining("Invalid bbox")
                .hasFieldOrPropertyWithValue("code", 400);
    }

    @Test
    void testHttpErrorStatus() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH)).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.getServiceInfo(TIMEOUT))
                .isInstanceOf(ImageServiceException.class)
                .hasMessageContaining("HTTP 503")
                .hasFieldOrPropertyWithValue("code", 503);
    }

    @Test
    void testMalformedJson() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH)).willReturn(aResponse().withStatus(200).withBody("<html>")));

        assertThatThrownBy(() -> client.getServiceInfo(TIMEOUT))
                .isInstanceOf(ImageServiceException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void testExportImageWithoutHref() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .willReturn(okJson("{\"width\": 256, \"height\": 256}")));

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(0, 0, 1, 1))
                .build();

        assertThatThrownBy(() -> client.exportImage(request, TIMEOUT))
                .isInstanceOf(ImageServiceException.class)
                .hasMessageContaining("no href");
    }

    @Test
    void testRequestTimeout() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH)).willReturn(okJson("{}").withFixedDelay(2_000)));

        assertThatThrownBy(() -> client.getServiceInfo(Duration.ofMillis(200)))
                .isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void testExportImageBytesInline() throws IOException {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("f", equalTo("image"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "image/png").withBody(png)));

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(0, 0, 1, 1))
                .build();

        assertThat(client.exportImageBytes(request, TIMEOUT)).isEqualTo(png);
    }

    @Test
    void testExportImageBytesInlineError() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("f", equalTo("image"))
                .willReturn(okJson("{\"error\": {\"code\": 500, \"message\": \"Error exporting image\"}}")));

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(0, 0, 1, 1))
                .build();

        assertThatThrownBy(() -> client.exportImageBytes(request, TIMEOUT))
                .isInstanceOf(ImageServiceException.class)
                .hasMessageContaining("Error exporting image");
    }

    @Test
    void testExportImageBytesInlineErrorUpperCaseContentTypeTurkishLocale() {
        wm.stubFor(get(urlPathEqualTo(SERVICE_PATH + "/exportImage"))
                .withQueryParam("f", equalTo("image"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "APPLICATION/JSON; CHARSET=UTF-8")
                        .withBody("{\"error\": {\"code\": 400, \"message\": \"Invalid bbox\"}}")));

        ExportImageRequest request = ExportImageRequest.builder()
                .bbox(BoundingBox2D.geographic(0, 0, 1, 1))
                .build();

        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThatThrownBy(() -> client.exportImageBytes(request, TIMEOUT))
                    .isInstanceOf(ImageServiceException.class)
                    .hasMessageContaining("Invalid bbox");
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }
}
