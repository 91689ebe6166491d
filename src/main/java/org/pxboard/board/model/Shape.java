package org.pxboard.board.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Describes the geometry of a board as a hierarchy of tiling levels.
 * <p>
 * A shape is a list of levels, outermost first. Each level lists one extent per axis.
 * The innermost level is the layout of a single sector, every other level describes
 * how sectors are tiled. This makes the mapping between a linear pixel position and
 * its {@code (sector, offset)} pair a plain division:
 * <pre>
 *   sector = position / sectorSize
 *   offset = position % sectorSize
 * </pre>
 * Within a level, axis 0 varies fastest.
 * <p>
 * <strong>Thread Safety:</strong> Immutable.
 */
public final class Shape {

    private final List<List<Integer>> levels;
    private final long sectorSize;
    private final long sectorCount;
    private final long[] levelProducts;
    private final int dimensionality;
    private final long[] dimensions;

    /**
     * Creates a shape from its levels.
     *
     * @param levels Levels outermost first, each a non-empty list of positive extents.
     * @throws IllegalArgumentException if the levels are empty, contain an empty level or a
     *                                  non-positive extent, or the resulting sizes do not fit the
     *                                  addressing limits.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Shape(final List<List<Integer>> levels) {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("A shape needs at least one level");
        }

        final List<List<Integer>> copy = new ArrayList<>(levels.size());
        int dims = 0;
        for (final List<Integer> level : levels) {
            if (level == null || level.isEmpty()) {
                throw new IllegalArgumentException("Shape levels must not be empty: " + levels);
            }
            for (final Integer extent : level) {
                if (extent == null || extent < 1) {
                    throw new IllegalArgumentException("Shape extents must be positive: " + levels);
                }
            }
            copy.add(List.copyOf(level));
            dims = Math.max(dims, level.size());
        }
        this.levels = Collections.unmodifiableList(copy);
        this.dimensionality = dims;

        this.levelProducts = new long[copy.size()];
        for (int i = 0; i < copy.size(); i++) {
            long product = 1;
            for (final int extent : copy.get(i)) {
                product = Math.multiplyExact(product, extent);
            }
            levelProducts[i] = product;
        }

        this.sectorSize = levelProducts[levelProducts.length - 1];
        long count = 1;
        for (int i = 0; i < levelProducts.length - 1; i++) {
            count = Math.multiplyExact(count, levelProducts[i]);
        }
        this.sectorCount = count;

        if (sectorCount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many sectors for shape " + levels);
        }
        // Timestamps are the widest buffer; a sector of them must fit in one array.
        if (sectorSize * BufferKind.TIMESTAMPS.width() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Sectors too large for shape " + levels);
        }

        this.dimensions = new long[dims];
        Arrays.fill(dimensions, 1);
        for (final List<Integer> level : copy) {
            for (int axis = 0; axis < level.size(); axis++) {
                dimensions[axis] = Math.multiplyExact(dimensions[axis], level.get(axis));
            }
        }
    }

    /**
     * Convenience factory, e.g. {@code Shape.of(new int[]{4}, new int[]{4})}.
     */
    public static Shape of(final int[]... levels) {
        final List<List<Integer>> list = new ArrayList<>(levels.length);
        for (final int[] level : levels) {
            final List<Integer> extents = new ArrayList<>(level.length);
            for (final int extent : level) {
                extents.add(extent);
            }
            list.add(extents);
        }
        return new Shape(list);
    }

    @JsonValue
    public List<List<Integer>> levels() {
        return levels;
    }

    /** Number of pixels in one sector, the product of the innermost level's extents. */
    public long sectorSize() {
        return sectorSize;
    }

    /** Number of sectors, the product of every level but the innermost. */
    public long sectorCount() {
        return sectorCount;
    }

    public long totalSize() {
        return sectorCount * sectorSize;
    }

    public int dimensionality() {
        return dimensionality;
    }

    /**
     * Returns the size of the board along each axis.
     */
    public long[] dimensions() {
        return dimensions.clone();
    }

    /**
     * Maps a linear position to the sector holding it and the offset inside that sector.
     *
     * @param position The linear pixel position.
     * @return The location, or empty if the position lies outside the board.
     */
    public Optional<SectorLocation> toLocal(final long position) {
        if (position < 0 || position >= totalSize()) {
            return Optional.empty();
        }
        return Optional.of(new SectorLocation((int) (position / sectorSize), (int) (position % sectorSize)));
    }

    /**
     * Inverse of {@link #toLocal(long)}.
     *
     * @throws IllegalArgumentException if the sector or offset is out of range.
     */
    public long toPosition(final int sector, final int offset) {
        if (sector < 0 || sector >= sectorCount || offset < 0 || offset >= sectorSize) {
            throw new IllegalArgumentException("No pixel at sector " + sector + " offset " + offset);
        }
        return sector * sectorSize + offset;
    }

    /**
     * Returns the smallest contiguous run of sector indices overlapping the pixel range
     * {@code [start, end)}. The result is clamped to the existing sectors and may be empty.
     */
    public SectorRange sectorsWithin(final long start, final long end) {
        if (end <= start || start >= totalSize()) {
            final int clamped = (int) Math.min(Math.max(start, 0) / sectorSize, sectorCount);
            return new SectorRange(clamped, clamped);
        }
        final long first = Math.max(start, 0) / sectorSize;
        final long last = Math.min(ceilDiv(end, sectorSize), sectorCount);
        return new SectorRange((int) first, (int) last);
    }

    /**
     * Returns the coordinates of a position in the board's N-dimensional space.
     *
     * @throws IllegalArgumentException if the position lies outside the board.
     */
    public long[] toCoordinates(final long position) {
        if (position < 0 || position >= totalSize()) {
            throw new IllegalArgumentException("Position " + position + " outside of shape " + levels);
        }
        final long[] coordinates = new long[dimensionality];
        final long[] scale = new long[dimensionality];
        Arrays.fill(scale, 1);

        long remainder = position;
        for (int i = levels.size() - 1; i >= 0; i--) {
            final List<Integer> level = levels.get(i);
            long local = remainder % levelProducts[i];
            remainder /= levelProducts[i];
            for (int axis = 0; axis < level.size(); axis++) {
                final int extent = level.get(axis);
                coordinates[axis] += (local % extent) * scale[axis];
                local /= extent;
                scale[axis] *= extent;
            }
        }
        return coordinates;
    }

    /**
     * Returns the linear position of the given coordinates.
     *
     * @return The position, or empty if the coordinates fall outside the board.
     * @throws IllegalArgumentException if the number of coordinates does not match the dimensionality.
     */
    public OptionalLong toPosition(final long[] coordinates) {
        if (coordinates.length != dimensionality) {
            throw new IllegalArgumentException("Expected " + dimensionality + " coordinates, got " + coordinates.length);
        }
        for (int axis = 0; axis < dimensionality; axis++) {
            if (coordinates[axis] < 0 || coordinates[axis] >= dimensions[axis]) {
                return OptionalLong.empty();
            }
        }

        final long[] scale = new long[dimensionality];
        Arrays.fill(scale, 1);
        long position = 0;
        long multiplier = 1;
        for (int i = levels.size() - 1; i >= 0; i--) {
            final List<Integer> level = levels.get(i);
            long local = 0;
            long stride = 1;
            for (int axis = 0; axis < level.size(); axis++) {
                final int extent = level.get(axis);
                local += ((coordinates[axis] / scale[axis]) % extent) * stride;
                stride *= extent;
                scale[axis] *= extent;
            }
            position += local * multiplier;
            multiplier *= levelProducts[i];
        }
        return OptionalLong.of(position);
    }

    /**
     * Maps a position of one shape onto the pixel with the same coordinates in another shape.
     *
     * @return The position in {@code to}, or empty if that pixel does not exist there.
     * @throws IllegalArgumentException if the shapes differ in dimensionality or the position
     *                                  lies outside {@code from}.
     */
    public static OptionalLong transform(final Shape from, final Shape to, final long position) {
        if (from.dimensionality != to.dimensionality) {
            throw new IllegalArgumentException("Cannot map between " + from.dimensionality
                + " and " + to.dimensionality + " dimensions");
        }
        return to.toPosition(from.toCoordinates(position));
    }

    private static long ceilDiv(final long x, final long y) {
        return -Math.floorDiv(-x, y);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Shape)) {
            return false;
        }
        return levels.equals(((Shape) o).levels);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return levels.toString();
    }

    /**
     * A pixel's sector index and offset within the sector.
     */
    public record SectorLocation(int sector, int offset) {
    }

    /**
     * Half-open range of sector indices.
     */
    public record SectorRange(int start, int end) {

        public boolean isEmpty() {
            return end <= start;
        }

        public int size() {
            return Math.max(0, end - start);
        }
    }
}
