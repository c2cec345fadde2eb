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

/**
 * Decides whether a fetched tile holds no data at all.
 * <p>
 * Blank tiles are neither stored nor subdivided, which is what keeps a pyramid from growing
 * into the empty areas around the imagery.
 */
@FunctionalInterface
public interface BlankTileClassifier {

    /**
     * @param tile the tile the image belongs to
     * @param data the encoded image
     * @return {@code true} if the image is uniformly no data
     */
    boolean isBlank(TileIndex tile, byte[] data);
}
