package org.pxboard.board.exceptions;

/**
 * Thrown when the backing store could not load or persist data.
 */
public class StorageFailureException extends BoardException {

    public StorageFailureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
