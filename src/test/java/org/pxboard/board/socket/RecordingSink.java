package org.pxboard.board.socket;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Socket transport that records frames and the close code.
 */
public final class RecordingSink implements ConnectionSink {

    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile int closeCode = -1;

    @Override
    public void send(final String frame) {
        frames.add(frame);
    }

    @Override
    public void close(final int code, final String reason) {
        closeCode = code;
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    /**
     * Frames containing the given packet type.
     */
    public List<String> framesOfType(final String type) {
        return frames.stream()
            .filter(frame -> frame.contains("\"type\":\"" + type + "\""))
            .collect(Collectors.toList());
    }

    public int closeCode() {
        return closeCode;
    }

    public boolean isClosed() {
        return closeCode >= 0;
    }
}
