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
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recognizes blank tiles by the size of their encoding.
 * <p>
 * A fully transparent 256x256 PNG produced by ArcGIS compresses to one of a few fixed sizes
 * ({@code 776} or {@code 777} bytes), while tiles with imagery are much larger. This is a
 * heuristic: a different server, encoder or image format needs a different set of lengths,
 * and a tile with actual content could in theory share one of them. Decoding the image and
 * checking its pixels would be exact.
 */
public class ByteLengthBlankTileClassifier implements BlankTileClassifier {

    public static final Set<Integer> DEFAULT_BLANK_LENGTHS = Set.of(776, 777);

    private final Set<Integer> blankLengths;

    public ByteLengthBlankTileClassifier() {
        this(DEFAULT_BLANK_LENGTHS);
    }

    public ByteLengthBlankTileClassifier(Set<Integer> blankLengths) {
        this.blankLengths = Set.copyOf(blankLengths);
    }

    public static ByteLengthBlankTileClassifier of(int... blankLengths) {
        return new ByteLengthBlankTileClassifier(
                Arrays.stream(blankLengths).boxed().collect(Collectors.toSet()));
    }

    @Override
    public boolean isBlank(TileIndex tile, byte[] data) {
        return blankLengths.contains(data.length);
    }

    @Override
    public String toString() {
        return "ByteLengthBlankTileClassifier" + blankLengths;
    }
}
