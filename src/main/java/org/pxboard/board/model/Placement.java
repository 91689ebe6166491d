package org.pxboard.board.model;

/**
 * A single recorded pixel placement.
 *
 * @param id        Store-assigned identifier.
 * @param boardId   Board the placement belongs to.
 * @param position  Linear pixel position.
 * @param color     Palette index that was placed.
 * @param timestamp Seconds since the board was created, at least 1.
 * @param userId    Placing user.
 */
public record Placement(long id, int boardId, long position, int color, int timestamp, String userId) {
}
