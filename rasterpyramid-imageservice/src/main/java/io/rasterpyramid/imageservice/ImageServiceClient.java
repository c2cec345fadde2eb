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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the ArcGIS REST API of an {@code ImageServer} or {@code MapServer} endpoint.
 * <p>
 * Supports the two operations needed to build a raster pyramid: reading the service
 * description (to learn its full extent), and exporting a rendered image of an arbitrary
 * bounding box. An export is a two step affair: {@link #exportImage} returns a JSON document
 * referencing the rendered image, which is then downloaded with {@link #fetchImage}.
 * {@link #exportImageBytes} requests the image bytes in a single round trip instead.
 * <p>
 * Instances are thread-safe and are meant to be shared by all fetch workers.
 *
 * <pre>{@code
 * ImageServiceClient client = ImageServiceClient.builder()
 *         .endpoint(URI.create("https://example.com/arcgis/rest/services/Ortho/ImageServer"))
 *         .build();
 * ServiceInfo info = client.getServiceInfo(Duration.ofSeconds(30));
 * }</pre>
 */
@NullMarked
public class ImageServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ImageServiceClient.class);

    static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final URI endpoint;

    private final HttpClient httpClient;

    private ImageServiceClient(URI endpoint, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    public URI getEndpoint() {
        return endpoint;
    }

    /**
     * Reads the service description from {@code {endpoint}?f=json}.
     *
     * @param timeout maximum time to wait for the response
     * @return the parsed service description
     * @throws ImageServiceException if the service responds with an error or an unparseable document
     * @throws IOException           if the request can't be performed or times out
     */
    public ServiceInfo getServiceInfo(Duration timeout) throws IOException {
        URI uri = URI.create(endpoint + "?f=json");
        HttpResponse<byte[]> response = send(uri, timeout);
        JsonNode json = parseJson(uri, response);
        return convert(uri, json, ServiceInfo.class);
    }

    /**
     * Issues an {@code exportImage} request asking for a JSON response.
     *
     * @param request the export parameters
     * @param timeout maximum time to wait for the response
     * @return the export result, with a non-null {@link ExportImageResponse#href() href}
     * @throws ImageServiceException if the service responds with an error, an unparseable document,
     *                               or a document without {@code href}
     * @throws IOException           if the request can't be performed or times out
     */
    public ExportImageResponse exportImage(ExportImageRequest request, Duration timeout) throws IOException {
        URI uri = exportImageUri(request, "pjson");
        HttpResponse<byte[]> response = send(uri, timeout);
        JsonNode json = parseJson(uri, response);
        ExportImageResponse result = convert(uri, json, ExportImageResponse.class);
        if (result.href() == null || result.href().isBlank()) {
            throw new ImageServiceException("exportImage response has no href: " + uri);
        }
        return result;
    }

    /**
     * Downloads the image referenced by an {@link #exportImage} result.
     * <p>
     * A relative {@code href} is resolved against the service endpoint.
     *
     * @param exported the export result
     * @param timeout  maximum time to wait for the response
     * @return the image bytes, as returned by the server
     * @throws IOException if the download fails or times out
     */
    public byte[] fetchImage(ExportImageResponse exported, Duration timeout) throws IOException {
        String href = requireNonNull(exported.href(), "href");
        URI uri = endpoint.resolve(href);
        return send(uri, timeout).body();
    }

    /**
     * Issues an {@code exportImage} request with {@code f=image}, returning the image inline.
     *
     * @throws ImageServiceException if the service responds with an error document instead of an image
     * @throws IOException           if the request can't be performed or times out
     */
    public byte[] exportImageBytes(ExportImageRequest request, Duration timeout) throws IOException {
        URI uri = exportImageUri(request, "image");
        HttpResponse<byte[]> response = send(uri, timeout);
        String contentType =
                response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (contentType.contains("json") || contentType.startsWith("text/")) {
            // services report export failures as a 200 response with an error document
            parseJson(uri, response);
            throw new ImageServiceException("Expected an image from " + uri + ", got " + contentType);
        }
        return response.body();
    }

    URI exportImageUri(ExportImageRequest request, String responseFormat) {
        return URI.create(endpoint + "/exportImage?" + encode(request.toQueryParameters(responseFormat)));
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /**
     * Performs a GET request, bounding the whole exchange, body included, by {@code timeout}.
     * <p>
     * {@link HttpRequest#timeout} only covers the wait for the response headers, so the exchange
     * is also awaited with the same limit and cancelled once it runs out.
     */
    private HttpResponse<byte[]> send(URI uri, Duration timeout) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        log.debug("GET {}", uri);
        CompletableFuture<HttpResponse<byte[]>> exchange = httpClient.sendAsync(request, BodyHandlers.ofByteArray());
        HttpResponse<byte[]> response;
        try {
            response = exchange.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            HttpTimeoutException timedOut =
                    new HttpTimeoutException("Request to " + uri + " not completed within " + timeout);
            timedOut.initCause(e);
            throw timedOut;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioe) {
                throw ioe;
            }
            throw new IOException("Error requesting " + uri, cause);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            InterruptedIOException iioe = new InterruptedIOException("Interrupted while requesting " + uri);
            iioe.initCause(e);
            throw iioe;
        }
        final int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new ImageServiceException("HTTP " + status + " requesting " + uri, status);
        }
        return response;
    }

    private JsonNode parseJson(URI uri, HttpResponse<byte[]> response) throws ImageServiceException {
        JsonNode json;
        try {
            json = MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new ImageServiceException("Invalid JSON response from " + uri, e);
        }
        if (json == null || !json.isObject()) {
            throw new ImageServiceException("Expected a JSON object from " + uri);
        }
        checkError(uri, json);
        return json;
    }

    private static void checkError(URI uri, JsonNode json) throws ImageServiceException {
        JsonNode error = json.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt(0);
            @Nullable String message = error.path("message").asText(null);
            throw new ImageServiceException("Service error %d requesting %s: %s".formatted(code, uri, message), code);
        }
    }

    private static <T> T convert(URI uri, JsonNode json, Class<T> type) throws ImageServiceException {
        try {
            return MAPPER.treeToValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ImageServiceException("Unexpected %s document from %s".formatted(type.getSimpleName(), uri), e);
        }
    }

    public static class Builder {

        public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(5);

        @Nullable
        private URI endpoint;

        private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;

        @Nullable
        private HttpClient httpClient;

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            return endpoint(URI.create(endpoint));
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = requireNonNull(connectionTimeout);
            return this;
        }

        /**
         * Uses the given client instead of creating one; {@link #connectionTimeout} is then ignored.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public ImageServiceClient build() {
            requireNonNull(endpoint, "endpoint is required");
            String scheme = endpoint.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException("Unsupported endpoint URI scheme: " + endpoint);
            }
            String normalized = endpoint.toString();
            while (normalized.endsWith("/")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            HttpClient client = httpClient;
            if (client == null) {
                client = HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(connectionTimeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
            }
            return new ImageServiceClient(URI.create(normalized), client);
        }
    }
}
