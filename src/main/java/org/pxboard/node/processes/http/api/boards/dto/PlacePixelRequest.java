package org.pxboard.node.processes.http.api.boards.dto;

/**
 * Body of {@code POST /boards/{id}/pixels/{position}}.
 */
public record PlacePixelRequest(Integer color) {
}
