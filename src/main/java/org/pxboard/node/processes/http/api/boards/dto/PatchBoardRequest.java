package org.pxboard.node.processes.http.api.boards.dto;

import org.pxboard.board.model.PaletteColor;
import org.pxboard.board.model.Shape;

import java.util.Map;

/**
 * Body of {@code PATCH /boards/{id}}; absent fields are left unchanged. The shape of an
 * existing board cannot be changed.
 */
public record PatchBoardRequest(String name, Shape shape, Map<Integer, PaletteColor> palette,
                                Integer maxPixelsAvailable, Integer maxStacked) {
}
