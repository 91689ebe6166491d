package org.pxboard.store;

/**
 * Thrown when a write violates a store constraint, e.g. a placement for a board that no
 * longer exists.
 */
public class StoreConflictException extends StoreException {

    public StoreConflictException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
