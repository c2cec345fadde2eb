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

/**
 * Pixel dimensions of an exported image.
 */
public record ImageSize(int width, int height) {

    public static final ImageSize TILE_256 = new ImageSize(256, 256);

    public static final ImageSize TILE_512 = new ImageSize(512, 512);

    public ImageSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: %dx%d".formatted(width, height));
        }
    }

    String toQueryValue() {
        return width + "," + height;
    }
}
