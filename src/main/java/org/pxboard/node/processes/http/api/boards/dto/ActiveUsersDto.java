package org.pxboard.node.processes.http.api.boards.dto;

/**
 * Answer of {@code GET /boards/{id}/users}.
 *
 * @param active      Distinct users who placed within the idle window.
 * @param idleTimeout Length of the idle window in seconds.
 */
public record ActiveUsersDto(int active, long idleTimeout) {
}
