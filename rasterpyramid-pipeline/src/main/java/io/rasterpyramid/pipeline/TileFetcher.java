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

import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;

/**
 * Fetches the encoded image of a single tile from a remote source.
 * <p>
 * Implementations are called concurrently by all fetch workers and must be thread-safe.
 * Any {@link IOException} is considered transient and may lead to the fetch being retried.
 */
@FunctionalInterface
public interface TileFetcher {

    byte[] fetch(TileIndex tile) throws IOException;
}
