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
package io.rasterpyramid.mbtiles;

import static org.assertj.core.api.Assertions.assertThat;

import io.rasterpyramid.tiling.pyramid.TileIndex;
import org.junit.jupiter.api.Test;

class TileRecordTest {

    @Test
    void of_invertsTheRow() {
        TileRecord record = TileRecord.of(new TileIndex(12, 650, 1350), new byte[] {1});

        assertThat(record.zoom()).isEqualTo(12);
        assertThat(record.column()).isEqualTo(650);
        assertThat(record.row()).isEqualTo(4095 - 1350);
        assertThat(record.tileIndex()).isEqualTo(new TileIndex(12, 650, 1350));
    }

    @Test
    void equals_comparesPayloadContents() {
        assertThat(new TileRecord(1, 0, 0, new byte[] {1, 2})).isEqualTo(new TileRecord(1, 0, 0, new byte[] {1, 2}));
        assertThat(new TileRecord(1, 0, 0, new byte[] {1, 2})).isNotEqualTo(new TileRecord(1, 0, 0, new byte[] {2}));
    }
}
