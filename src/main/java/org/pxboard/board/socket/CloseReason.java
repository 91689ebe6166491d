package org.pxboard.board.socket;

/**
 * Close codes sent when the server ends a socket connection.
 */
public enum CloseReason {
    SERVER_CLOSING(1001, "Server closing"),
    INVALID_PACKET(1008, "Invalid packet"),
    SERVER_ERROR(1011, "Server error"),
    AUTH_TIMEOUT(4000, "Authentication timeout"),
    MISSING_PERMISSION(4001, "Missing permission"),
    INVALID_TOKEN(4002, "Invalid token");

    private final int code;
    private final String reason;

    CloseReason(final int code, final String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }
}
