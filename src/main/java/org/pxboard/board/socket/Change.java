package org.pxboard.board.socket;

import java.util.Arrays;

/**
 * Consecutive values written to one buffer starting at a position.
 */
public record Change(long position, long[] values) {

    public Change {
        values = values.clone();
    }

    public static Change single(final long position, final long value) {
        return new Change(position, new long[]{value});
    }

    /** Exclusive end position. */
    public long end() {
        return position + values.length;
    }

    @Override
    public long[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Change)) {
            return false;
        }
        final Change other = (Change) o;
        return position == other.position && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(position) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Change{position=" + position + ", values=" + Arrays.toString(values) + '}';
    }
}
