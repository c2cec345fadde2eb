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
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a {@link FetchTask}: either the fetched image bytes or the error that made the
 * last attempt fail.
 *
 * @param tile     the fetched tile
 * @param data     the image bytes, {@code null} if the fetch failed
 * @param failure  the last error, {@code null} if the fetch succeeded
 * @param attempts the number of attempts made
 */
@NullMarked
public record FetchResult(TileIndex tile, byte @Nullable [] data, @Nullable Throwable failure, int attempts) {

    public FetchResult {
        requireNonNull(tile, "tile");
        if ((data == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of data or failure is expected");
        }
    }

    public static FetchResult success(TileIndex tile, byte[] data, int attempts) {
        return new FetchResult(tile, requireNonNull(data, "data"), null, attempts);
    }

    public static FetchResult failed(TileIndex tile, Throwable failure, int attempts) {
        return new FetchResult(tile, null, requireNonNull(failure, "failure"), attempts);
    }

    public boolean isFailed() {
        return failure != null;
    }

    /**
     * @throws IllegalStateException if the fetch failed
     */
    public byte[] requireData() {
        if (data == null) {
            throw new IllegalStateException("Fetch of " + tile + " failed", failure);
        }
        return data;
    }

    @Override
    public String toString() {
        return isFailed()
                ? "FetchResult[%s failed after %d attempts: %s]".formatted(tile, attempts, failure)
                : "FetchResult[%s, %,d bytes]".formatted(tile, data.length);
    }
}
