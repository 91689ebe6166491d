package org.pxboard.board.exceptions;

/**
 * Thrown when a socket client does not follow the connection handshake.
 */
public class MalformedHandshakeException extends BoardException {

    public MalformedHandshakeException(final String message) {
        super(message);
    }

    public MalformedHandshakeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
