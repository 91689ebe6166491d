package org.pxboard.board.exceptions;

/**
 * Base class of all failures a board operation reports to its caller.
 */
public abstract class BoardException extends Exception {

    protected BoardException(final String message) {
        super(message);
    }

    protected BoardException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
