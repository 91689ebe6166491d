package org.pxboard.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.PaletteColor;
import org.pxboard.board.model.Placement;
import org.pxboard.board.model.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * H2 implementation of {@link IBoardStore} using HikariCP for connection pooling.
 * <p>
 * The schema is created on startup if missing. Shapes and palettes are stored as JSON.
 * <p>
 * Configuration options:
 * <ul>
 *   <li>{@code jdbcUrl} (required)</li>
 *   <li>{@code username}, {@code password} (default {@code sa} / empty)</li>
 *   <li>{@code maxPoolSize} (default 10), {@code minIdle} (default 2)</li>
 * </ul>
 */
public class H2BoardStore implements IBoardStore {

    private static final Logger log = LoggerFactory.getLogger(H2BoardStore.class);

    private static final TypeReference<Map<Integer, PaletteColor>> PALETTE_TYPE = new TypeReference<>() { };

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS boards ("
            + "id INT AUTO_INCREMENT PRIMARY KEY, "
            + "name VARCHAR(255) NOT NULL, "
            + "created_at BIGINT NOT NULL, "
            + "shape VARCHAR(4096) NOT NULL, "
            + "palette VARCHAR(1000000) NOT NULL, "
            + "max_pixels_available INT NOT NULL, "
            + "max_stacked INT NOT NULL)",
        "CREATE TABLE IF NOT EXISTS board_sectors ("
            + "board_id INT NOT NULL, "
            + "buffer_kind VARCHAR(16) NOT NULL, "
            + "sector_index INT NOT NULL, "
            + "sector_data BLOB NOT NULL, "
            + "PRIMARY KEY (board_id, buffer_kind, sector_index), "
            + "FOREIGN KEY (board_id) REFERENCES boards(id) ON DELETE CASCADE)",
        "CREATE TABLE IF NOT EXISTS placements ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
            + "board_id INT NOT NULL, "
            + "pixel_position BIGINT NOT NULL, "
            + "color INT NOT NULL, "
            + "placed_at INT NOT NULL, "
            + "user_id VARCHAR(255) NOT NULL, "
            + "FOREIGN KEY (board_id) REFERENCES boards(id) ON DELETE CASCADE)",
        "CREATE INDEX IF NOT EXISTS idx_placements_user ON placements(board_id, user_id, id)",
        "CREATE INDEX IF NOT EXISTS idx_placements_position ON placements(board_id, pixel_position, id)",
        "CREATE INDEX IF NOT EXISTS idx_placements_time ON placements(board_id, placed_at)"
    };

    private static final String PLACEMENT_COLUMNS = "id, board_id, pixel_position, color, placed_at, user_id";

    private final String name;
    private final HikariDataSource dataSource;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Creates the store, opens its connection pool and ensures the schema exists.
     *
     * @param name    Name used for the pool and in log messages.
     * @param options Database options.
     * @throws IllegalStateException if the database cannot be opened.
     */
    public H2BoardStore(final String name, final Config options) {
        this.name = name;

        final HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(options.getString("jdbcUrl"));
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (final RuntimeException e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            final String message = String.format("Failed to open board store '%s' at %s: %s",
                name, hikariConfig.getJdbcUrl(), cause.getMessage());
            log.error(message);
            throw new IllegalStateException(message, e);
        }

        try {
            createSchema();
        } catch (final SQLException e) {
            dataSource.close();
            throw new IllegalStateException("Failed to create schema for board store '" + name + "'", e);
        }
        log.debug("Board store '{}' ready (pool max={}, minIdle={})",
            name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (final String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        }
    }

    @Override
    public Optional<byte[]> loadSector(final int boardId, final BufferKind kind, final int index) throws StoreException {
        final String sql = "SELECT sector_data FROM board_sectors WHERE board_id = ? AND buffer_kind = ? AND sector_index = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setString(2, kind.pathName());
            stmt.setInt(3, index);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getBytes(1)) : Optional.empty();
            }
        } catch (final SQLException e) {
            throw failure("load sector " + boardId + "/" + kind.pathName() + "/" + index, e);
        }
    }

    @Override
    public void storeSector(final int boardId, final BufferKind kind, final int index, final byte[] data) throws StoreException {
        final String sql = "MERGE INTO board_sectors (board_id, buffer_kind, sector_index, sector_data) "
            + "KEY (board_id, buffer_kind, sector_index) VALUES (?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setString(2, kind.pathName());
            stmt.setInt(3, index);
            stmt.setBytes(4, data);
            stmt.executeUpdate();
        } catch (final SQLException e) {
            throw failure("store sector " + boardId + "/" + kind.pathName() + "/" + index, e);
        }
    }

    @Override
    public List<Placement> loadPlacementHistory(final int boardId, final String userId, final int limit) throws StoreException {
        final String sql = "SELECT " + PLACEMENT_COLUMNS + " FROM placements "
            + "WHERE board_id = ? AND user_id = ? ORDER BY id DESC LIMIT ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setString(2, userId);
            stmt.setInt(3, limit);
            final List<Placement> placements = readPlacements(stmt);
            Collections.reverse(placements);
            return placements;
        } catch (final SQLException e) {
            throw failure("load placement history of '" + userId + "'", e);
        }
    }

    @Override
    public List<Placement> loadPlacementsSince(final int boardId, final int timestamp) throws StoreException {
        final String sql = "SELECT " + PLACEMENT_COLUMNS + " FROM placements "
            + "WHERE board_id = ? AND placed_at >= ? ORDER BY placed_at, id";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setInt(2, timestamp);
            return readPlacements(stmt);
        } catch (final SQLException e) {
            throw failure("load recent placements of board " + boardId, e);
        }
    }

    @Override
    public List<Placement> listPlacements(final int boardId, final int afterTimestamp, final long afterId,
                                          final int limit, final PlacementFilter filter) throws StoreException {
        final StringBuilder sql = new StringBuilder("SELECT ").append(PLACEMENT_COLUMNS).append(" FROM placements ")
            .append("WHERE board_id = ? AND (placed_at > ? OR (placed_at = ? AND id > ?))");
        final List<Long> bounds = new ArrayList<>();
        appendRange(sql, bounds, "pixel_position", filter.position());
        appendRange(sql, bounds, "color", filter.color());
        appendRange(sql, bounds, "placed_at", filter.timestamp());
        if (filter.userId() != null) {
            sql.append(" AND user_id = ?");
        }
        sql.append(" ORDER BY placed_at, id LIMIT ?");

        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int index = 1;
            stmt.setInt(index++, boardId);
            stmt.setInt(index++, afterTimestamp);
            stmt.setInt(index++, afterTimestamp);
            stmt.setLong(index++, afterId);
            for (final Long bound : bounds) {
                stmt.setLong(index++, bound);
            }
            if (filter.userId() != null) {
                stmt.setString(index++, filter.userId());
            }
            stmt.setInt(index, limit);
            return readPlacements(stmt);
        } catch (final SQLException e) {
            throw failure("list placements of board " + boardId, e);
        }
    }

    private static void appendRange(final StringBuilder sql, final List<Long> bounds, final String column,
                                    final PlacementFilter.Range range) {
        if (range.min() != null) {
            sql.append(" AND ").append(column).append(" >= ?");
            bounds.add(range.min());
        }
        if (range.max() != null) {
            sql.append(" AND ").append(column).append(" <= ?");
            bounds.add(range.max());
        }
    }

    @Override
    public Placement recordPlacement(final int boardId, final long position, final int color,
                                     final int timestamp, final String userId) throws StoreException {
        final String sql = "INSERT INTO placements (board_id, pixel_position, color, placed_at, user_id) VALUES (?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setInt(1, boardId);
            stmt.setLong(2, position);
            stmt.setInt(3, color);
            stmt.setInt(4, timestamp);
            stmt.setString(5, userId);
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for placement", null);
                }
                return new Placement(keys.getLong(1), boardId, position, color, timestamp, userId);
            }
        } catch (final SQLIntegrityConstraintViolationException e) {
            throw new StoreConflictException("Placement rejected by board store '" + name + "'", e);
        } catch (final SQLException e) {
            throw failure("record placement at " + position, e);
        }
    }

    @Override
    public Optional<Placement> latestPlacement(final int boardId, final long position) throws StoreException {
        final String sql = "SELECT " + PLACEMENT_COLUMNS + " FROM placements "
            + "WHERE board_id = ? AND pixel_position = ? ORDER BY id DESC LIMIT 1";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setLong(2, position);
            return readPlacements(stmt).stream().findFirst();
        } catch (final SQLException e) {
            throw failure("look up placement at " + position, e);
        }
    }

    @Override
    public Optional<Placement> previousPlacement(final int boardId, final long position, final long beforeId) throws StoreException {
        final String sql = "SELECT " + PLACEMENT_COLUMNS + " FROM placements "
            + "WHERE board_id = ? AND pixel_position = ? AND id < ? ORDER BY id DESC LIMIT 1";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setLong(2, position);
            stmt.setLong(3, beforeId);
            return readPlacements(stmt).stream().findFirst();
        } catch (final SQLException e) {
            throw failure("look up previous placement at " + position, e);
        }
    }

    @Override
    public boolean deletePlacement(final int boardId, final long placementId) throws StoreException {
        final String sql = "DELETE FROM placements WHERE board_id = ? AND id = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            stmt.setLong(2, placementId);
            return stmt.executeUpdate() > 0;
        } catch (final SQLException e) {
            throw failure("delete placement " + placementId, e);
        }
    }

    @Override
    public Optional<BoardInfo> loadBoardMetadata(final int boardId) throws StoreException {
        final String sql = "SELECT id, name, created_at, shape, palette, max_pixels_available, max_stacked FROM boards WHERE id = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readBoard(rs)) : Optional.empty();
            }
        } catch (final SQLException e) {
            throw failure("load board " + boardId, e);
        }
    }

    @Override
    public List<BoardInfo> listBoards() throws StoreException {
        final String sql = "SELECT id, name, created_at, shape, palette, max_pixels_available, max_stacked FROM boards ORDER BY id";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            final List<BoardInfo> boards = new ArrayList<>();
            while (rs.next()) {
                boards.add(readBoard(rs));
            }
            return boards;
        } catch (final SQLException e) {
            throw failure("list boards", e);
        }
    }

    @Override
    public BoardInfo createBoard(final String boardName, final Instant createdAt, final Shape shape,
                                 final Map<Integer, PaletteColor> palette, final int maxPixelsAvailable,
                                 final int maxStacked) throws StoreException {
        final String sql = "INSERT INTO boards (name, created_at, shape, palette, max_pixels_available, max_stacked) "
            + "VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, boardName);
            stmt.setLong(2, createdAt.getEpochSecond());
            stmt.setString(3, mapper.writeValueAsString(shape));
            stmt.setString(4, mapper.writeValueAsString(palette));
            stmt.setInt(5, maxPixelsAvailable);
            stmt.setInt(6, maxStacked);
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for board '" + boardName + "'", null);
                }
                final BoardInfo info = new BoardInfo(keys.getInt(1), boardName, Instant.ofEpochSecond(createdAt.getEpochSecond()),
                    shape, palette, maxPixelsAvailable, maxStacked);
                log.debug("Created board {} '{}' with shape {}", info.id(), boardName, shape);
                return info;
            }
        } catch (final SQLException | JsonProcessingException e) {
            throw failure("create board '" + boardName + "'", e);
        }
    }

    @Override
    public void updateBoardMetadata(final BoardInfo info) throws StoreException {
        final String sql = "UPDATE boards SET name = ?, palette = ?, max_pixels_available = ?, max_stacked = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, info.name());
            stmt.setString(2, mapper.writeValueAsString(info.palette()));
            stmt.setInt(3, info.maxPixelsAvailable());
            stmt.setInt(4, info.maxStacked());
            stmt.setInt(5, info.id());
            if (stmt.executeUpdate() == 0) {
                throw new StoreConflictException("Board " + info.id() + " no longer exists", null);
            }
        } catch (final SQLException | JsonProcessingException e) {
            throw failure("update board " + info.id(), e);
        }
    }

    @Override
    public boolean deleteBoard(final int boardId) throws StoreException {
        final String sql = "DELETE FROM boards WHERE id = ?";
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, boardId);
            final boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                log.debug("Deleted board {} from store '{}'", boardId, name);
            }
            return deleted;
        } catch (final SQLException e) {
            throw failure("delete board " + boardId, e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("Board store '{}' closed", name);
        }
    }

    private List<Placement> readPlacements(final PreparedStatement stmt) throws SQLException {
        final List<Placement> placements = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                placements.add(new Placement(
                    rs.getLong("id"),
                    rs.getInt("board_id"),
                    rs.getLong("pixel_position"),
                    rs.getInt("color"),
                    rs.getInt("placed_at"),
                    rs.getString("user_id")));
            }
        }
        return placements;
    }

    private BoardInfo readBoard(final ResultSet rs) throws SQLException {
        try {
            return new BoardInfo(
                rs.getInt("id"),
                rs.getString("name"),
                Instant.ofEpochSecond(rs.getLong("created_at")),
                mapper.readValue(rs.getString("shape"), Shape.class),
                mapper.readValue(rs.getString("palette"), PALETTE_TYPE),
                rs.getInt("max_pixels_available"),
                rs.getInt("max_stacked"));
        } catch (final JsonProcessingException e) {
            throw new SQLException("Corrupt metadata for board " + rs.getInt("id"), e);
        }
    }

    private StoreException failure(final String action, final Exception e) {
        return new StoreException("Board store '" + name + "' failed to " + action, e);
    }
}
