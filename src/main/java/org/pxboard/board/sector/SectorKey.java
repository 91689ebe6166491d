package org.pxboard.board.sector;

import org.pxboard.board.model.BufferKind;

/**
 * Identifies one sector of one buffer of a board.
 */
public record SectorKey(int boardId, BufferKind kind, int index) {

    @Override
    public String toString() {
        return boardId + "/" + kind.pathName() + "/" + index;
    }
}
