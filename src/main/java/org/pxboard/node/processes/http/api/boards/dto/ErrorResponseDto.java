package org.pxboard.node.processes.http.api.boards.dto;

import io.javalin.http.HttpStatus;

import java.time.Instant;

/**
 * Body of every error response.
 *
 * @param timestamp ISO-8601 time of the error.
 * @param status    HTTP status code.
 * @param error     HTTP status message, e.g. "Conflict".
 * @param message   What went wrong.
 */
public record ErrorResponseDto(String timestamp, int status, String error, String message) {

    public static ErrorResponseDto of(final HttpStatus status, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status.getCode(), status.getMessage(), message);
    }
}
