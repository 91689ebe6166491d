package org.pxboard.board.sector;

import org.pxboard.board.exceptions.OutOfBoundsException;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.Shape;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear view of one board's buffers on top of the {@link SectorCache}.
 * <p>
 * Translates pixel positions and byte ranges into sector requests using the board's {@link Shape}.
 * Every read and write of board data goes through this class.
 */
public class SectorAccessor {

    private final int boardId;
    private final Shape shape;
    private final SectorCache cache;

    public SectorAccessor(final int boardId, final Shape shape, final SectorCache cache) {
        this.boardId = boardId;
        this.shape = shape;
        this.cache = cache;
        cache.registerBoard(boardId, shape.sectorSize());
    }

    public Shape shape() {
        return shape;
    }

    /**
     * Total size in bytes of a buffer.
     */
    public long length(final BufferKind kind) {
        return shape.totalSize() * kind.width();
    }

    /**
     * Reads the bytes {@code [start, end)} of a buffer. The end is clamped to the buffer length.
     *
     * @throws OutOfBoundsException    if the range is inverted or starts outside the buffer.
     * @throws StorageFailureException if a sector could not be loaded.
     */
    public byte[] read(final BufferKind kind, final long start, final long end)
        throws OutOfBoundsException, StorageFailureException {
        final long length = length(kind);
        if (start < 0 || end < start || (start >= length && end > start)) {
            throw new OutOfBoundsException("Range " + start + ".." + end + " outside of " + length + " bytes");
        }
        final long clampedEnd = Math.min(end, length);
        if (clampedEnd - start > Integer.MAX_VALUE - 8) {
            throw new OutOfBoundsException("Range " + start + ".." + end + " too large for a single read");
        }

        final byte[] result = new byte[(int) (clampedEnd - start)];
        if (result.length == 0) {
            return result;
        }

        final int width = kind.width();
        final long sectorBytes = shape.sectorSize() * width;
        final Shape.SectorRange sectors = shape.sectorsWithin(start / width, -Math.floorDiv(-clampedEnd, width));
        for (int index = sectors.start(); index < sectors.end(); index++) {
            final long sectorStart = index * sectorBytes;
            final long from = Math.max(start, sectorStart);
            final long to = Math.min(clampedEnd, sectorStart + sectorBytes);
            try (Sector.Lease lease = cache.get(new SectorKey(boardId, kind, index))) {
                lease.copyTo((int) (from - sectorStart), result, (int) (from - start), (int) (to - from));
            }
        }
        return result;
    }

    /**
     * Reads the element of a buffer at a pixel position.
     */
    public long readValue(final BufferKind kind, final long position) throws OutOfBoundsException, StorageFailureException {
        final Shape.SectorLocation location = locate(position);
        try (Sector.Lease lease = cache.get(new SectorKey(boardId, kind, location.sector()))) {
            return lease.read(location.offset());
        }
    }

    /**
     * Overwrites the element of a buffer at a pixel position.
     */
    public void write(final BufferKind kind, final long position, final long value)
        throws OutOfBoundsException, StorageFailureException {
        try (PixelLock pixel = lock(kind, position)) {
            pixel.set(value);
        }
    }

    /**
     * Locks the sector holding a pixel exclusively so the caller can check and update it
     * atomically. The lock must be released by closing the returned handle.
     */
    public PixelLock lock(final BufferKind kind, final long position) throws OutOfBoundsException, StorageFailureException {
        final Shape.SectorLocation location = locate(position);
        return new PixelLock(cache.getMut(new SectorKey(boardId, kind, location.sector())), location.offset());
    }

    /**
     * Writes consecutive elements starting at a pixel position.
     *
     * @param bytes Raw little-endian elements; the length must be a multiple of the buffer width.
     * @throws OutOfBoundsException if the data does not fit inside the buffer.
     */
    public void patch(final BufferKind kind, final long position, final byte[] bytes)
        throws OutOfBoundsException, StorageFailureException {
        patch(kind, position, bytes, () -> { });
    }

    /**
     * Writes consecutive elements starting at a pixel position. All touched sectors are locked
     * before anything is written, in sector order, and stay locked while {@code whileLocked}
     * runs, so a failed load leaves the buffer untouched.
     *
     * @param bytes       Raw little-endian elements; the length must be a multiple of the buffer width.
     * @param whileLocked Called after the write, before the locks are released.
     * @throws OutOfBoundsException if the data does not fit inside the buffer.
     */
    public void patch(final BufferKind kind, final long position, final byte[] bytes, final Runnable whileLocked)
        throws OutOfBoundsException, StorageFailureException {
        final int width = kind.width();
        if (bytes.length % width != 0) {
            throw new IllegalArgumentException("Patch of " + bytes.length + " bytes is not a multiple of " + width);
        }
        final long pixels = bytes.length / width;
        if (position < 0 || position > shape.totalSize() - pixels) {
            throw new OutOfBoundsException("Patch of " + pixels + " pixels at " + position + " exceeds the board");
        }

        final long start = position * width;
        final long end = start + bytes.length;
        final long sectorBytes = shape.sectorSize() * width;
        final Shape.SectorRange sectors = shape.sectorsWithin(position, position + pixels);
        final List<Sector.Lease> leases = new ArrayList<>();
        try {
            for (int index = sectors.start(); index < sectors.end(); index++) {
                leases.add(cache.getMut(new SectorKey(boardId, kind, index)));
            }
            for (int i = 0; i < leases.size(); i++) {
                final long sectorStart = (long) (sectors.start() + i) * sectorBytes;
                final long from = Math.max(start, sectorStart);
                final long to = Math.min(end, sectorStart + sectorBytes);
                leases.get(i).writeBytes((int) (from - sectorStart), bytes, (int) (from - start), (int) (to - from));
            }
            whileLocked.run();
        } finally {
            for (final Sector.Lease lease : leases) {
                lease.close();
            }
        }
    }

    private Shape.SectorLocation locate(final long position) throws OutOfBoundsException {
        return shape.toLocal(position)
            .orElseThrow(() -> new OutOfBoundsException("Position " + position + " is outside the board"));
    }

    /**
     * Exclusive access to one pixel of one buffer.
     */
    public static final class PixelLock implements AutoCloseable {

        private final Sector.Lease lease;
        private final int offset;

        private PixelLock(final Sector.Lease lease, final int offset) {
            this.lease = lease;
            this.offset = offset;
        }

        public long get() {
            return lease.read(offset);
        }

        public void set(final long value) {
            lease.write(offset, value);
        }

        @Override
        public void close() {
            lease.close();
        }
    }
}
