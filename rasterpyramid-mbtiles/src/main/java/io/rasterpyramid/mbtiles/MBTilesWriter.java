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

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Writes tiles to an MBTiles (SQLite) file in batched transactions.
 * <p>
 * Tiles are upserted ({@code INSERT OR REPLACE}) so writing the same coordinates twice keeps
 * the last payload. Writes accumulate in an open transaction that is committed every
 * {@code batchSize} tiles, and on {@link #commit()} and {@link #close()}. If a write or commit
 * fails, only the open transaction is lost: the writer rolls it back, refuses further writes,
 * and previously committed batches stay in the file.
 * <p>
 * The connection is tuned for bulk loading, trading crash safety for speed (in-memory journal,
 * no fsync); a run that fails midway leaves a partial but consistent file.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe, meant to be owned by a single writer thread.
 *
 * @see <a href="https://github.com/mapbox/mbtiles-spec/blob/master/1.3/spec.md">MBTiles Specification</a>
 */
@NullMarked
public class MBTilesWriter implements TileArchiveWriter {

    private static final Logger log = LoggerFactory.getLogger(MBTilesWriter.class);

    public static final int DEFAULT_BATCH_SIZE = 1000;

    static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS tiles (
                zoom_level INTEGER NOT NULL,
                tile_column INTEGER NOT NULL,
                tile_row INTEGER NOT NULL,
                tile_data BLOB NOT NULL
            )""",
            "CREATE UNIQUE INDEX IF NOT EXISTS tiles_index ON tiles (zoom_level, tile_column, tile_row)",
            "CREATE TABLE IF NOT EXISTS metadata (name TEXT, value TEXT)",
            "CREATE UNIQUE INDEX IF NOT EXISTS metadata_index ON metadata (name)");

    private static final String INSERT_TILE =
            "INSERT OR REPLACE INTO tiles (zoom_level, tile_column, tile_row, tile_data) VALUES (?, ?, ?, ?)";

    private final Path path;

    private final Connection connection;

    private final PreparedStatement insertTile;

    private final int batchSize;

    private int pending;

    private long written;

    private long commits;

    private boolean failed;

    private boolean closed;

    private MBTilesWriter(Path path, Connection connection, int batchSize) throws SQLException {
        this.path = path;
        this.connection = connection;
        this.batchSize = batchSize;
        createSchema();
        this.insertTile = connection.prepareStatement(INSERT_TILE);
    }

    /**
     * Opens or creates the MBTiles file at {@code path} with the {@link #DEFAULT_BATCH_SIZE default batch size}.
     *
     * @throws IOException if the file can't be opened or its schema can't be created
     */
    public static MBTilesWriter open(Path path) throws IOException {
        return open(path, DEFAULT_BATCH_SIZE);
    }

    /**
     * Opens or creates the MBTiles file at {@code path}.
     *
     * @param batchSize the number of tiles written per transaction
     * @throws IOException if the file can't be opened or its schema can't be created
     */
    public static MBTilesWriter open(Path path, int batchSize) throws IOException {
        requireNonNull(path, "path");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.MEMORY);
        config.setSynchronous(SQLiteConfig.SynchronousMode.OFF);
        config.setTempStore(SQLiteConfig.TempStore.MEMORY);
        String url = "jdbc:sqlite:" + path.toAbsolutePath();
        @Nullable Connection connection = null;
        try {
            connection = DriverManager.getConnection(url, config.toProperties());
            connection.setAutoCommit(false);
            MBTilesWriter writer = new MBTilesWriter(path, connection, batchSize);
            log.debug("Opened {} for writing, batch size {}", path, batchSize);
            return writer;
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new IOException("Unable to open MBTiles file " + path, e);
        }
    }

    private void createSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        }
        connection.commit();
    }

    public Path getPath() {
        return path;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Replaces the contents of the {@code metadata} table, committing any pending tiles along with it.
     */
    @Override
    public void writeMetadata(MBTilesMetadata metadata) throws IOException {
        checkWritable();
        try (Statement delete = connection.createStatement();
                PreparedStatement insert =
                        connection.prepareStatement("INSERT INTO metadata (name, value) VALUES (?, ?)")) {
            delete.execute("DELETE FROM metadata");
            for (Map.Entry<String, String> row : metadata.toMap().entrySet()) {
                insert.setString(1, row.getKey());
                insert.setString(2, row.getValue());
                insert.addBatch();
            }
            insert.executeBatch();
            commitInternal();
        } catch (SQLException e) {
            throw fail("Unable to write metadata to " + path, e);
        }
    }

    @Override
    public void write(TileRecord tile) throws IOException {
        checkWritable();
        try {
            insertTile.setInt(1, tile.zoom());
            insertTile.setInt(2, tile.column());
            insertTile.setInt(3, tile.row());
            insertTile.setBytes(4, tile.data());
            insertTile.executeUpdate();
        } catch (SQLException e) {
            throw fail("Unable to write " + tile + " to " + path, e);
        }
        written++;
        if (++pending >= batchSize) {
            commit();
        }
    }

    @Override
    public void commit() throws IOException {
        checkWritable();
        try {
            commitInternal();
        } catch (SQLException e) {
            throw fail("Unable to commit tiles to " + path, e);
        }
    }

    private void commitInternal() throws SQLException {
        connection.commit();
        commits++;
        if (pending > 0) {
            log.info("Committed {} tiles to {} ({} total)", pending, path.getFileName(), written);
        }
        pending = 0;
    }

    @Override
    public long tilesWritten() {
        return written;
    }

    /**
     * @return the number of transactions committed so far
     */
    public long commits() {
        return commits;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (failed) {
                connection.rollback();
            } else {
                commitInternal();
            }
            insertTile.close();
        } catch (SQLException e) {
            throw new IOException("Error closing " + path, e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Error closing connection to {}", path, e);
            }
        }
    }

    private void checkWritable() {
        if (closed) {
            throw new IllegalStateException("MBTiles writer is closed: " + path);
        }
        if (failed) {
            throw new IllegalStateException("MBTiles writer failed and no longer accepts writes: " + path);
        }
    }

    private IOException fail(String message, SQLException cause) {
        failed = true;
        // the open transaction is lost, only committed tiles remain
        written -= pending;
        pending = 0;
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
        return new IOException(message, cause);
    }

    private static void closeQuietly(@Nullable Connection connection, Exception cause) {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                cause.addSuppressed(e);
            }
        }
    }
}
