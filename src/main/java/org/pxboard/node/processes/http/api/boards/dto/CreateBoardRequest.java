package org.pxboard.node.processes.http.api.boards.dto;

import org.pxboard.board.model.PaletteColor;
import org.pxboard.board.model.Shape;

import java.util.Map;

/**
 * Body of {@code POST /boards}.
 */
public record CreateBoardRequest(String name, Shape shape, Map<Integer, PaletteColor> palette,
                                 Integer maxPixelsAvailable, Integer maxStacked) {
}
