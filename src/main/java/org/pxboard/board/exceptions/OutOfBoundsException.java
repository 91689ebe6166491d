package org.pxboard.board.exceptions;

/**
 * Thrown when a position or range lies outside the board.
 */
public class OutOfBoundsException extends BoardException {

    public OutOfBoundsException(final String message) {
        super(message);
    }
}
