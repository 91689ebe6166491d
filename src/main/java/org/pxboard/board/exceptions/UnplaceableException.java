package org.pxboard.board.exceptions;

/**
 * Thrown when the mask forbids placing at a position.
 */
public class UnplaceableException extends BoardException {

    public UnplaceableException(final long position) {
        super("Position " + position + " is not placeable");
    }
}
