package org.pxboard.board.socket;

import java.io.IOException;

/**
 * Transport behind a {@link Connection}.
 */
public interface ConnectionSink {

    /**
     * Sends one complete text frame.
     */
    void send(String frame) throws IOException;

    /**
     * Closes the transport with a close code.
     */
    void close(int code, String reason);
}
