package org.pxboard.board.sector;

import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A resident chunk of one buffer.
 * <p>
 * Access goes through {@link Lease}s: any number of shared leases or one exclusive lease
 * at a time. Writes bump a version number; the sector is dirty while its version is
 * ahead of the last persisted one.
 * <p>
 * Write-backs of one sector are serialized by a separate flush lock, taken before the
 * read/write lock, so snapshots reach the backing store in version order.
 */
public final class Sector {

    private final SectorKey key;
    private final byte[] data;
    private final int width;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock flushLock = new ReentrantLock();

    private volatile long version;
    private volatile long persistedVersion;
    private volatile long lastAccess;
    private volatile boolean evicted;

    /**
     * Creates a clean sector. A sector that was never stored starts clean as well, since
     * all-zero bytes are what loading it would produce.
     */
    Sector(final SectorKey key, final byte[] data) {
        this.key = key;
        this.data = data;
        this.width = key.kind().width();
    }

    public SectorKey key() {
        return key;
    }

    /** Size in bytes. */
    public int length() {
        return data.length;
    }

    public boolean isDirty() {
        return version != persistedVersion;
    }

    long lastAccess() {
        return lastAccess;
    }

    void touch(final long tick) {
        this.lastAccess = tick;
    }

    boolean isEvicted() {
        return evicted;
    }

    Lease acquireShared() {
        lock.readLock().lock();
        return new Lease(false);
    }

    Lease acquireExclusive() {
        lock.writeLock().lock();
        return new Lease(true);
    }

    boolean tryLockExclusive() {
        return lock.writeLock().tryLock();
    }

    void unlockExclusive() {
        lock.writeLock().unlock();
    }

    void lockFlush() {
        flushLock.lock();
    }

    boolean tryLockFlush() {
        return flushLock.tryLock();
    }

    void unlockFlush() {
        flushLock.unlock();
    }

    /**
     * Whether a snapshot is newer than what the backing store already holds.
     */
    boolean isAhead(final Snapshot snapshot) {
        return snapshot.version() > persistedVersion;
    }

    /**
     * Marks the sector as dropped from the cache. Caller must hold the exclusive lock.
     */
    void markEvicted() {
        this.evicted = true;
    }

    /**
     * Copies the current bytes. Caller must hold a lease or the exclusive lock.
     */
    Snapshot snapshot() {
        return new Snapshot(data.clone(), version);
    }

    /**
     * Records that the given snapshot reached the backing store.
     */
    synchronized void markPersisted(final long snapshotVersion) {
        if (snapshotVersion > persistedVersion) {
            persistedVersion = snapshotVersion;
        }
    }

    /**
     * Copy of a sector's bytes together with the version they represent.
     */
    record Snapshot(byte[] data, long version) {
    }

    /**
     * A held lock on the sector. Closing releases the lock; a lease cannot be reused.
     */
    public final class Lease implements AutoCloseable {

        private final boolean exclusive;
        private boolean closed;

        private Lease(final boolean exclusive) {
            this.exclusive = exclusive;
        }

        public SectorKey key() {
            return key;
        }

        public boolean isExclusive() {
            return exclusive;
        }

        /**
         * Reads the little-endian element at the given pixel offset.
         */
        public long read(final int offset) {
            checkOpen();
            final int base = offset * width;
            long value = 0;
            for (int i = 0; i < width; i++) {
                value |= (data[base + i] & 0xFFL) << (8 * i);
            }
            return value;
        }

        /**
         * Copies raw bytes starting at a byte offset.
         */
        public void copyTo(final int byteOffset, final byte[] target, final int targetOffset, final int length) {
            checkOpen();
            System.arraycopy(data, byteOffset, target, targetOffset, length);
        }

        /**
         * Writes the little-endian element at the given pixel offset.
         */
        public void write(final int offset, final long value) {
            checkWritable();
            final int base = offset * width;
            for (int i = 0; i < width; i++) {
                data[base + i] = (byte) (value >>> (8 * i));
            }
            version++;
        }

        /**
         * Overwrites raw bytes starting at a byte offset.
         */
        public void writeBytes(final int byteOffset, final byte[] source, final int sourceOffset, final int length) {
            checkWritable();
            System.arraycopy(source, sourceOffset, data, byteOffset, length);
            version++;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (exclusive) {
                lock.writeLock().unlock();
            } else {
                lock.readLock().unlock();
            }
        }

        private void checkOpen() {
            if (closed) {
                throw new IllegalStateException("Lease on sector " + key + " already released");
            }
        }

        private void checkWritable() {
            checkOpen();
            if (!exclusive) {
                throw new IllegalStateException("Sector " + key + " is leased read-only");
            }
        }
    }
}
