package org.pxboard.board.exceptions;

/**
 * Thrown when a request does not apply to the current state, e.g. placing the color a
 * pixel already has, or undoing someone else's placement.
 */
public class ConflictException extends BoardException {

    public ConflictException(final String message) {
        super(message);
    }

    public ConflictException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
