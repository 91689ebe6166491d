package org.pxboard.board.exceptions;

/**
 * Thrown when a color is not part of the board's palette.
 */
public class InvalidColorException extends BoardException {

    public InvalidColorException(final int color) {
        super("Color " + color + " is not in the palette");
    }
}
