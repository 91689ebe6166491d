package org.pxboard.board.model;

/**
 * A palette entry.
 *
 * @param name  Human readable name.
 * @param value RGBA value packed into an int.
 */
public record PaletteColor(String name, long value) {
}
