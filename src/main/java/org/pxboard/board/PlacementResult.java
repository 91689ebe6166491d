package org.pxboard.board;

import org.pxboard.board.cooldown.CooldownInfo;
import org.pxboard.board.model.Placement;

/**
 * Outcome of a successful placement or undo.
 *
 * @param placement The placement made or undone.
 * @param cooldown  The user's availability afterwards.
 */
public record PlacementResult(Placement placement, CooldownInfo cooldown) {
}
