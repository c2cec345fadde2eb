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
package io.rasterpyramid.cli;

import io.rasterpyramid.imageservice.ExtentResolver;
import io.rasterpyramid.imageservice.ImageServiceClient;
import io.rasterpyramid.mbtiles.MBTilesWriter;
import io.rasterpyramid.pipeline.ImageServiceTileFetcher;
import io.rasterpyramid.pipeline.PyramidConfig;
import io.rasterpyramid.pipeline.PyramidStats;
import io.rasterpyramid.pipeline.TilePyramidPipeline;
import io.rasterpyramid.tiling.common.BoundingBox2D;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.Callable;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Builds an MBTiles pyramid from an ArcGIS image service.
 * <p>
 * The service's full extent is covered at the minimum zoom level, and every tile with content is
 * subdivided down to the maximum zoom level. Options given on the command line override those
 * read from {@code --config}.
 */
@Command(
        name = "imageservice-to-mbtiles",
        mixinStandardHelpOptions = true,
        description = "Builds an MBTiles tile pyramid from an ArcGIS image service.",
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
            "0: pyramid built",
            "1: service or storage failure",
            "2: invalid command line arguments"
        })
public class ImageServiceToMBTilesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImageServiceToMBTilesCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-e", "--endpoint"},
            required = true,
            description = "Image service endpoint, e.g. https://host/arcgis/rest/services/Ortho/ImageServer")
    private URI endpoint;

    @Option(
            names = {"-o", "--output"},
            required = true,
            description = "MBTiles file to write; existing tiles at the same coordinates are replaced")
    private Path output;

    @Option(names = "--config", description = "Properties file with io.rasterpyramid.* settings")
    private @Nullable Path configFile;

    @Option(names = "--name", description = "Tileset name (default: base name of the output file)")
    private @Nullable String name;

    @Option(names = "--format", description = "Image format requested from the service (default: png)")
    private @Nullable String format;

    @Option(names = "--min-zoom", description = "Zoom level of the base cover (default: 12)")
    private @Nullable Integer minZoom;

    @Option(names = "--max-zoom", description = "Deepest zoom level to subdivide to (default: 20)")
    private @Nullable Integer maxZoom;

    @Option(names = "--concurrency", description = "Number of concurrent tile fetches (default: 32)")
    private @Nullable Integer concurrency;

    @Option(names = "--batch-size", description = "Tiles per storage commit (default: 1000)")
    private @Nullable Integer batchSize;

    @Option(names = "--max-attempts", description = "Fetch attempts per tile before dropping it (default: 3)")
    private @Nullable Integer maxAttempts;

    @Option(names = "--timeout", description = "Deadline in seconds for fetching one tile (default: 15)")
    private @Nullable Integer timeoutSeconds;

    @Option(
            names = "--no-data",
            description = "Comma separated pixel values rendered transparent, empty for none (default: 255)")
    private @Nullable String noData;

    @Option(names = "--inline", description = "Request images inline instead of exporting and downloading them")
    private boolean inline;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ImageServiceToMBTilesCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        final PyramidConfig config = buildConfig();
        final ImageServiceClient client = buildClient(config);

        BoundingBox2D extent;
        try {
            extent = new ExtentResolver(client, config.requestTimeout()).resolveGeographicExtent();
        } catch (IOException e) {
            log.error("Unable to determine the extent of {}: {}", client.getEndpoint(), e.getMessage());
            return EXIT_FAILURE;
        }

        try (MBTilesWriter archive = MBTilesWriter.open(output, config.batchSize())) {
            ImageServiceTileFetcher fetcher = new ImageServiceTileFetcher(client, config);
            PyramidStats stats = new TilePyramidPipeline(config, fetcher, archive).run(extent);
            log.info("Wrote {} tiles to {}", stats.getPersisted(), output);
            if (stats.getFailed() > 0) {
                log.warn("{} tiles could not be fetched and were skipped", stats.getFailed());
            }
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Failed to build pyramid into {}", output, e);
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted, pyramid in {} is incomplete", output);
            return EXIT_FAILURE;
        }
    }

    PyramidConfig buildConfig() {
        Properties props = loadConfigFile();
        PyramidConfig.Builder builder;
        try {
            builder = PyramidConfig.fromProperties(props).toBuilder();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(
                    spec.commandLine(), "Invalid configuration in " + configFile + ": " + e.getMessage(), e);
        }
        if (name != null) {
            builder.name(name);
        } else if (props.getProperty(PyramidConfig.NAME) == null) {
            builder.name(baseName(output));
        }
        if (format != null) {
            builder.format(format);
        }
        if (minZoom != null) {
            builder.minZoom(minZoom);
        }
        if (maxZoom != null) {
            builder.maxZoom(maxZoom);
        }
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (maxAttempts != null) {
            builder.maxAttempts(maxAttempts);
        }
        if (timeoutSeconds != null) {
            builder.requestTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (inline) {
            builder.inlineExport(true);
        }
        try {
            if (noData != null) {
                builder.noData(PyramidConfig.parseNoData(noData));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Properties loadConfigFile() {
        Properties props = new Properties();
        if (configFile != null) {
            try (InputStream in = Files.newInputStream(configFile)) {
                props.load(in);
            } catch (IOException e) {
                throw new ParameterException(
                        spec.commandLine(), "Unable to read config file " + configFile + ": " + e.getMessage(), e);
            }
        }
        return props;
    }

    private ImageServiceClient buildClient(PyramidConfig config) {
        try {
            return ImageServiceClient.builder()
                    .endpoint(endpoint)
                    .connectionTimeout(config.requestTimeout())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid endpoint " + endpoint + ": " + e.getMessage(), e);
        }
    }

    static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
