package org.pxboard.board.exceptions;

/**
 * Thrown when no board exists for a given id.
 */
public class BoardNotFoundException extends BoardException {

    public BoardNotFoundException(final int boardId) {
        super("Board " + boardId + " does not exist");
    }

    public BoardNotFoundException(final String message) {
        super(message);
    }
}
