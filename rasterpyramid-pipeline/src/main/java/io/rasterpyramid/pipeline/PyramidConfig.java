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

import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Settings of a single pyramid run.
 * <p>
 * Instances are created with a {@link #builder()}, or from {@link Properties} using the
 * {@code io.rasterpyramid.*} keys declared in this class; absent keys take their default.
 *
 * <pre>{@code
 * PyramidConfig config = PyramidConfig.builder()
 *         .name("kamloops")
 *         .minZoom(12)
 *         .maxZoom(20)
 *         .concurrency(32)
 *         .build();
 * }</pre>
 *
 * @param name                the tileset name written to the MBTiles metadata
 * @param format              the image format requested from the service and declared in the metadata
 * @param minZoom             the zoom level of the base tiles covering the service extent
 * @param maxZoom             the deepest zoom level to subdivide into
 * @param concurrency         the number of fetch workers
 * @param resultQueueCapacity the capacity of the queue between fetch workers and the writer
 * @param batchSize           the number of tiles written per transaction
 * @param maxAttempts         the number of fetch attempts per tile, including the first one
 * @param retryBackoff        the wait before the first retry, doubled on each further retry
 * @param requestTimeout      the deadline for fetching a single tile
 * @param progressInterval    how often queue depths are logged
 * @param inlineExport        whether tiles are exported with {@code f=image} in a single round trip
 * @param noData              pixel values the service renders transparent, empty for none
 */
@NullMarked
public record PyramidConfig(
        String name,
        String format,
        int minZoom,
        int maxZoom,
        int concurrency,
        int resultQueueCapacity,
        int batchSize,
        int maxAttempts,
        Duration retryBackoff,
        Duration requestTimeout,
        Duration progressInterval,
        boolean inlineExport,
        List<Integer> noData) {

    public static final String PREFIX = "io.rasterpyramid.";
    public static final String NAME = PREFIX + "name";
    public static final String FORMAT = PREFIX + "format";
    public static final String MIN_ZOOM = PREFIX + "min-zoom";
    public static final String MAX_ZOOM = PREFIX + "max-zoom";
    public static final String CONCURRENCY = PREFIX + "concurrency";
    public static final String RESULT_QUEUE_CAPACITY = PREFIX + "result-queue-capacity";
    public static final String BATCH_SIZE = PREFIX + "batch-size";
    public static final String MAX_ATTEMPTS = PREFIX + "max-attempts";
    public static final String RETRY_BACKOFF_MILLIS = PREFIX + "retry-backoff-millis";
    public static final String REQUEST_TIMEOUT_MILLIS = PREFIX + "request-timeout-millis";
    public static final String PROGRESS_INTERVAL_MILLIS = PREFIX + "progress-interval-millis";
    public static final String INLINE_EXPORT = PREFIX + "inline-export";
    public static final String NO_DATA = PREFIX + "no-data";

    public static final int DEFAULT_MIN_ZOOM = 12;
    public static final int DEFAULT_MAX_ZOOM = 20;
    public static final int DEFAULT_CONCURRENCY = 32;
    public static final int DEFAULT_RESULT_QUEUE_CAPACITY = 1000;
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_PROGRESS_INTERVAL = Duration.ofSeconds(1);
    public static final List<Integer> DEFAULT_NO_DATA = List.of(255);

    public PyramidConfig {
        requireNonNull(name, "name");
        requireNonNull(format, "format");
        requireNonNull(retryBackoff, "retryBackoff");
        requireNonNull(requestTimeout, "requestTimeout");
        requireNonNull(progressInterval, "progressInterval");
        noData = List.copyOf(requireNonNull(noData, "noData"));
        if (minZoom < 0 || maxZoom > TileIndex.MAX_ZOOM || minZoom > maxZoom) {
            throw new IllegalArgumentException("Invalid zoom range %d-%d, expected 0 <= minZoom <= maxZoom <= %d"
                    .formatted(minZoom, maxZoom, TileIndex.MAX_ZOOM));
        }
        requirePositive(concurrency, "concurrency");
        requirePositive(resultQueueCapacity, "resultQueueCapacity");
        requirePositive(batchSize, "batchSize");
        requirePositive(maxAttempts, "maxAttempts");
        if (retryBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("retryBackoff must be at least 1ms: " + retryBackoff);
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
        if (progressInterval.isNegative() || progressInterval.isZero()) {
            throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .format(format)
                .minZoom(minZoom)
                .maxZoom(maxZoom)
                .concurrency(concurrency)
                .resultQueueCapacity(resultQueueCapacity)
                .batchSize(batchSize)
                .maxAttempts(maxAttempts)
                .retryBackoff(retryBackoff)
                .requestTimeout(requestTimeout)
                .progressInterval(progressInterval)
                .inlineExport(inlineExport)
                .noData(noData);
    }

    /**
     * Creates a configuration from {@code io.rasterpyramid.*} properties.
     *
     * @throws IllegalArgumentException if a property can't be parsed or the resulting configuration is invalid
     */
    public static PyramidConfig fromProperties(Properties props) {
        Builder builder = builder();
        String name = props.getProperty(NAME);
        if (name != null) {
            builder.name(name);
        }
        String format = props.getProperty(FORMAT);
        if (format != null) {
            builder.format(format);
        }
        builder.minZoom(intValue(props, MIN_ZOOM, DEFAULT_MIN_ZOOM));
        builder.maxZoom(intValue(props, MAX_ZOOM, DEFAULT_MAX_ZOOM));
        builder.concurrency(intValue(props, CONCURRENCY, DEFAULT_CONCURRENCY));
        builder.resultQueueCapacity(intValue(props, RESULT_QUEUE_CAPACITY, DEFAULT_RESULT_QUEUE_CAPACITY));
        builder.batchSize(intValue(props, BATCH_SIZE, DEFAULT_BATCH_SIZE));
        builder.maxAttempts(intValue(props, MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS));
        builder.retryBackoff(millis(props, RETRY_BACKOFF_MILLIS, DEFAULT_RETRY_BACKOFF));
        builder.requestTimeout(millis(props, REQUEST_TIMEOUT_MILLIS, DEFAULT_REQUEST_TIMEOUT));
        builder.progressInterval(millis(props, PROGRESS_INTERVAL_MILLIS, DEFAULT_PROGRESS_INTERVAL));
        builder.inlineExport(Boolean.parseBoolean(props.getProperty(INLINE_EXPORT, "false")));
        @Nullable String noData = props.getProperty(NO_DATA);
        if (noData != null) {
            builder.noData(parseNoData(noData));
        }
        return builder.build();
    }

    /**
     * Parses a comma separated list of no-data values; a blank value means none.
     *
     * @throws IllegalArgumentException if a value is not an integer
     */
    public static List<Integer> parseNoData(String value) {
        List<Integer> values = new ArrayList<>();
        for (String token : value.split(",")) {
            if (token.isBlank()) {
                continue;
            }
            try {
                values.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid no-data value for " + NO_DATA + ": " + value, e);
            }
        }
        return values;
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        @Nullable String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + key + ": " + value, e);
        }
    }

    private static Duration millis(Properties props, String key, Duration defaultValue) {
        @Nullable String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds value for " + key + ": " + value, e);
        }
    }

    public static class Builder {
        private String name = "pyramid";
        private String format = "png";
        private int minZoom = DEFAULT_MIN_ZOOM;
        private int maxZoom = DEFAULT_MAX_ZOOM;
        private int concurrency = DEFAULT_CONCURRENCY;
        private int resultQueueCapacity = DEFAULT_RESULT_QUEUE_CAPACITY;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration progressInterval = DEFAULT_PROGRESS_INTERVAL;
        private boolean inlineExport;
        private List<Integer> noData = DEFAULT_NO_DATA;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder minZoom(int minZoom) {
            this.minZoom = minZoom;
            return this;
        }

        public Builder maxZoom(int maxZoom) {
            this.maxZoom = maxZoom;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder resultQueueCapacity(int resultQueueCapacity) {
            this.resultQueueCapacity = resultQueueCapacity;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder progressInterval(Duration progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder inlineExport(boolean inlineExport) {
            this.inlineExport = inlineExport;
            return this;
        }

        public Builder noData(List<Integer> noData) {
            this.noData = noData;
            return this;
        }

        public PyramidConfig build() {
            return new PyramidConfig(
                    name,
                    format,
                    minZoom,
                    maxZoom,
                    concurrency,
                    resultQueueCapacity,
                    batchSize,
                    maxAttempts,
                    retryBackoff,
                    requestTimeout,
                    progressInterval,
                    inlineExport,
                    noData);
        }
    }
}
