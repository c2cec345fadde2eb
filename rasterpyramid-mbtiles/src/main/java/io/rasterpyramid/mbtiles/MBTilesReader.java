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

import static java.util.Objects.requireNonNull;

import io.rasterpyramid.tiling.pyramid.TileIndex;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.NullMarked;
import org.sqlite.SQLiteConfig;

/**
 * Read-only access to the tiles and metadata of an MBTiles file.
 */
@NullMarked
public class MBTilesReader implements AutoCloseable {

    private final Path path;

    private final Connection connection;

    public MBTilesReader(Path path) throws IOException {
        this.path = requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new IOException("MBTiles file not found: " + path);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try {
            this.connection =
                    DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath(), config.toProperties());
        } catch (SQLException e) {
            throw new IOException("Unable to open MBTiles file " + path, e);
        }
    }

    /**
     * @param row the TMS row
     */
    public Optional<byte[]> getTile(int zoom, int column, int row) throws IOException {
        String sql = "SELECT tile_data FROM tiles WHERE zoom_level = ? AND tile_column = ? AND tile_row = ?";
        try (PreparedStatement st = connection.prepareStatement(sql)) {
            st.setInt(1, zoom);
            st.setInt(2, column);
            st.setInt(3, row);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(rs.getBytes(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Error reading tile %d/%d/%d from %s".formatted(zoom, column, row, path), e);
        }
    }

    /**
     * Shortcut for {@code getTile(tile.z(), tile.x(), tile.tmsRow())}.
     */
    public Optional<byte[]> getTile(TileIndex tile) throws IOException {
        return getTile(tile.z(), tile.x(), tile.tmsRow());
    }

    public long tileCount() throws IOException {
        return count("SELECT COUNT(*) FROM tiles", -1);
    }

    public long tileCount(int zoom) throws IOException {
        return count("SELECT COUNT(*) FROM tiles WHERE zoom_level = ?", zoom);
    }

    private long count(String sql, int zoom) throws IOException {
        try (PreparedStatement st = connection.prepareStatement(sql)) {
            if (zoom >= 0) {
                st.setInt(1, zoom);
            }
            try (ResultSet rs = st.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new IOException("Error counting tiles in " + path, e);
        }
    }

    /**
     * @return the XYZ addressed index of every stored tile, ordered by zoom, column and TMS row
     */
    public List<TileIndex> tileIndices() throws IOException {
        String sql = "SELECT zoom_level, tile_column, tile_row FROM tiles ORDER BY zoom_level, tile_column, tile_row";
        List<TileIndex> indices = new ArrayList<>();
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                indices.add(TileIndex.fromTmsRow(rs.getInt(1), rs.getInt(2), rs.getInt(3)));
            }
        } catch (SQLException e) {
            throw new IOException("Error listing tiles in " + path, e);
        }
        return indices;
    }

    public Map<String, String> metadata() throws IOException {
        Map<String, String> metadata = new LinkedHashMap<>();
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery("SELECT name, value FROM metadata")) {
            while (rs.next()) {
                metadata.put(rs.getString(1), rs.getString(2));
            }
        } catch (SQLException e) {
            throw new IOException("Error reading metadata from " + path, e);
        }
        return metadata;
    }

    @Override
    public void close() throws IOException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Error closing " + path, e);
        }
    }
}
