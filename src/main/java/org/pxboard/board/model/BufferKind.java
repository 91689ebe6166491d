package org.pxboard.board.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The independently stored per-pixel buffers of a board.
 * <p>
 * Multi-byte values are stored little-endian.
 */
public enum BufferKind {
    /** Current palette index of each pixel. */
    COLORS("colors", 1),
    /** Seconds since board creation of the last placement, 0 when never placed. */
    TIMESTAMPS("timestamps", 4),
    /** {@link MaskValue} of each pixel. */
    MASK("mask", 1),
    /** Palette index a pixel reverts to when all placements are undone. */
    INITIAL("initial", 1);

    private final String pathName;
    private final int width;

    BufferKind(final String pathName, final int width) {
        this.pathName = pathName;
        this.width = width;
    }

    /** Number of bytes per pixel. */
    public int width() {
        return width;
    }

    /** Name used in URLs and the storage schema. */
    public String pathName() {
        return pathName;
    }

    /**
     * Looks up a buffer by its path name, ignoring case.
     */
    public static Optional<BufferKind> fromPathName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        final String normalized = name.toLowerCase(Locale.ROOT);
        for (final BufferKind kind : values()) {
            if (kind.pathName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
