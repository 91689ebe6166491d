package org.pxboard.store;

import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.PaletteColor;
import org.pxboard.board.model.Placement;
import org.pxboard.board.model.Shape;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for boards, their sector buffers and placement history.
 * <p>
 * Calls block on I/O. Implementations must be safe for concurrent use.
 */
public interface IBoardStore extends AutoCloseable {

    /**
     * Loads the persisted bytes of a sector.
     *
     * @return The bytes, or empty if the sector was never stored.
     */
    Optional<byte[]> loadSector(int boardId, BufferKind kind, int index) throws StoreException;

    /**
     * Inserts or replaces the bytes of a sector.
     */
    void storeSector(int boardId, BufferKind kind, int index, byte[] data) throws StoreException;

    /**
     * Returns up to {@code limit} of the user's most recent placements, oldest first.
     */
    List<Placement> loadPlacementHistory(int boardId, String userId, int limit) throws StoreException;

    /**
     * Returns all placements with a timestamp of at least {@code timestamp}, oldest first.
     */
    List<Placement> loadPlacementsSince(int boardId, int timestamp) throws StoreException;

    /**
     * Returns up to {@code limit} placements matching the filter that come after the cursor
     * {@code (afterTimestamp, afterId)}, ordered by timestamp and then id.
     */
    List<Placement> listPlacements(int boardId, int afterTimestamp, long afterId, int limit, PlacementFilter filter)
        throws StoreException;

    /**
     * Records a placement.
     *
     * @return The placement with its assigned id.
     * @throws StoreConflictException if the placement violates a constraint.
     */
    Placement recordPlacement(int boardId, long position, int color, int timestamp, String userId) throws StoreException;

    /**
     * Returns the most recent placement at a position.
     */
    Optional<Placement> latestPlacement(int boardId, long position) throws StoreException;

    /**
     * Returns the most recent placement at a position that was recorded before the given one.
     */
    Optional<Placement> previousPlacement(int boardId, long position, long beforeId) throws StoreException;

    /**
     * Deletes a placement.
     *
     * @return Whether a placement was deleted.
     */
    boolean deletePlacement(int boardId, long placementId) throws StoreException;

    Optional<BoardInfo> loadBoardMetadata(int boardId) throws StoreException;

    List<BoardInfo> listBoards() throws StoreException;

    /**
     * Creates a board and returns it with its assigned id.
     */
    BoardInfo createBoard(String name, Instant createdAt, Shape shape, Map<Integer, PaletteColor> palette,
                          int maxPixelsAvailable, int maxStacked) throws StoreException;

    /**
     * Persists name, palette and pixel limits of an existing board.
     */
    void updateBoardMetadata(BoardInfo info) throws StoreException;

    /**
     * Deletes a board together with its sectors and placements.
     *
     * @return Whether the board existed.
     */
    boolean deleteBoard(int boardId) throws StoreException;

    @Override
    void close();
}
