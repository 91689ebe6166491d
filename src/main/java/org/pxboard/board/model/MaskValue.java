package org.pxboard.board.model;

/**
 * Per-pixel placement permission stored in the {@link BufferKind#MASK} buffer.
 */
public enum MaskValue {
    NO_PLACE(0),
    PLACE(1),
    /** Reserved for placement next to existing pixels; currently not placeable. */
    ADJACENT(2);

    private final int value;

    MaskValue(final int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Decodes a raw mask byte. Unknown values are treated as {@link #NO_PLACE}.
     */
    public static MaskValue fromValue(final int value) {
        for (final MaskValue mask : values()) {
            if (mask.value == value) {
                return mask;
            }
        }
        return NO_PLACE;
    }
}
