package org.pxboard.board;

import org.pxboard.board.exceptions.BoardNotFoundException;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.PaletteColor;
import org.pxboard.board.model.Shape;
import org.pxboard.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * All live boards, keyed by id.
 */
public class BoardRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardRegistry.class);

    private final BoardContext context;
    private final Map<Integer, Board> boards = new ConcurrentHashMap<>();

    public BoardRegistry(final BoardContext context) {
        this.context = context;
    }

    /**
     * Loads every stored board.
     *
     * @return Number of boards loaded.
     */
    public int loadAll() throws StorageFailureException {
        final List<BoardInfo> stored;
        try {
            stored = context.store().listBoards();
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to list boards", e);
        }
        for (final BoardInfo info : stored) {
            boards.put(info.id(), Board.load(info, context));
            LOGGER.debug("Loaded board {} ('{}', {} pixels)", info.id(), info.name(), info.shape().totalSize());
        }
        return stored.size();
    }

    public Board get(final int boardId) throws BoardNotFoundException {
        final Board board = boards.get(boardId);
        if (board == null) {
            throw new BoardNotFoundException(boardId);
        }
        return board;
    }

    /**
     * All boards ordered by id.
     */
    public List<Board> list() {
        final List<Board> result = new ArrayList<>(boards.values());
        result.sort(Comparator.comparingInt(Board::id));
        return result;
    }

    /**
     * Stores and activates a new board. Its buffers start zeroed, so nothing is placeable
     * until the mask is patched.
     */
    public Board create(final String name, final Shape shape, final Map<Integer, PaletteColor> palette,
                        final int maxPixelsAvailable, final int maxStacked) throws StorageFailureException {
        final BoardInfo info;
        try {
            info = context.store().createBoard(name, context.clock().instant(), shape, palette, maxPixelsAvailable, maxStacked);
        } catch (final StoreException e) {
            throw new StorageFailureException("Failed to create board '" + name + "'", e);
        }
        final Board board = new Board(info, context);
        boards.put(info.id(), board);
        LOGGER.info("Created board {} ('{}') with shape {}", info.id(), name, shape);
        return board;
    }

    /**
     * Deletes a board with its history and disconnects its sockets.
     *
     * @throws BoardNotFoundException  if the board does not exist.
     * @throws StorageFailureException if the store could not delete it; the board stays live.
     */
    public void delete(final int boardId) throws BoardNotFoundException, StorageFailureException {
        final Board board = boards.remove(boardId);
        if (board == null) {
            throw new BoardNotFoundException(boardId);
        }
        try {
            if (!context.store().deleteBoard(boardId)) {
                LOGGER.warn("Board {} was already missing from the store", boardId);
            }
        } catch (final StoreException e) {
            boards.put(boardId, board);
            throw new StorageFailureException("Failed to delete board " + boardId, e);
        }
        board.close();
        final int dropped = context.sectors().unregisterBoard(boardId);
        LOGGER.info("Deleted board {} ('{}'), dropped {} resident sectors", boardId, board.info().name(), dropped);
    }

    /**
     * The board with the lowest id.
     *
     * @throws BoardNotFoundException if there are no boards.
     */
    public Board first() throws BoardNotFoundException {
        return boards.values().stream()
            .min(Comparator.comparingInt(Board::id))
            .orElseThrow(() -> new BoardNotFoundException("There are no boards"));
    }

    public int size() {
        return boards.size();
    }
}
