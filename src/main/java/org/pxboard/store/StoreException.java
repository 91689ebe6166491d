package org.pxboard.store;

/**
 * Thrown when the backing store fails to execute an operation.
 */
public class StoreException extends Exception {

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
