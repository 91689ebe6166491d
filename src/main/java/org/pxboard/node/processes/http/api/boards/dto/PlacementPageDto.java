package org.pxboard.node.processes.http.api.boards.dto;

import org.pxboard.board.model.Placement;

import java.util.List;

/**
 * Answer of {@code GET /boards/{id}/pixels}.
 *
 * @param items    Placements on this page, oldest first.
 * @param next     URI of the following page, or {@code null} on the last page.
 * @param previous Always {@code null}; listings only page forward.
 */
public record PlacementPageDto(List<Placement> items, String next, String previous) {
}
