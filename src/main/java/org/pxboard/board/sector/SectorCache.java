package org.pxboard.board.sector;

import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.store.IBoardStore;
import org.pxboard.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps board sectors in memory on top of an {@link IBoardStore}.
 * <p>
 * Key features:
 * <ul>
 *   <li>Concurrent misses on one key share a single backing-store load.</li>
 *   <li>Access to a sector is guarded by its own read/write lock; there is no cache-wide lock.</li>
 *   <li>When over budget, least-recently-used sectors are flushed if dirty and dropped.
 *       Sectors currently leased are skipped.</li>
 *   <li>Dropping a sector never deletes stored data.</li>
 * </ul>
 * A lease obtained on a sector that is evicted while the caller waited for the lock is
 * discarded and the sector is fetched again, so no write is ever applied to a dropped copy.
 * A sector being flushed is never evicted at the same time.
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public class SectorCache implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectorCache.class);

    private final IBoardStore store;
    private final SectorCacheConfig config;
    private final Executor ioExecutor;

    private final Map<SectorKey, CompletableFuture<Sector>> sectors = new ConcurrentHashMap<>();
    private final Map<Integer, Integer> sectorSizes = new ConcurrentHashMap<>();
    private final AtomicLong clock = new AtomicLong();
    private final AtomicLong residentBytes = new AtomicLong();
    private final AtomicInteger residentCount = new AtomicInteger();
    private final AtomicBoolean evictionScheduled = new AtomicBoolean();

    /**
     * @param store      Backing store for loads and flushes.
     * @param config     Residency limits.
     * @param ioExecutor Executor running backing-store loads and background eviction.
     */
    public SectorCache(final IBoardStore store, final SectorCacheConfig config, final Executor ioExecutor) {
        this.store = store;
        this.config = config;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Declares the sector size of a board. Must be called before any of its sectors are requested.
     *
     * @param boardId    The board.
     * @param sectorSize Number of pixels per sector.
     */
    public void registerBoard(final int boardId, final long sectorSize) {
        sectorSizes.put(boardId, Math.toIntExact(sectorSize));
    }

    /**
     * Forgets a deleted board. Its resident sectors are dropped without being written back
     * and later requests for them fail.
     *
     * @return Number of sectors dropped.
     */
    public int unregisterBoard(final int boardId) {
        sectorSizes.remove(boardId);
        int dropped = 0;
        for (final Sector sector : residentSnapshot()) {
            if (sector.key().boardId() != boardId) {
                continue;
            }
            sector.lockFlush();
            try (Sector.Lease ignored = sector.acquireExclusive()) {
                if (sector.isEvicted()) {
                    continue;
                }
                sector.markEvicted();
                sectors.remove(sector.key());
                residentBytes.addAndGet(-sector.length());
                residentCount.decrementAndGet();
                dropped++;
            } finally {
                sector.unlockFlush();
            }
        }
        LOGGER.debug("Dropped {} sectors of board {}", dropped, boardId);
        return dropped;
    }

    /**
     * Returns a shared lease on a sector, loading it if needed.
     *
     * @throws StorageFailureException if the sector could not be loaded.
     */
    public Sector.Lease get(final SectorKey key) throws StorageFailureException {
        return acquire(key, false);
    }

    /**
     * Returns an exclusive lease on a sector, loading it if needed. Writes through the
     * lease mark the sector dirty.
     *
     * @throws StorageFailureException if the sector could not be loaded.
     */
    public Sector.Lease getMut(final SectorKey key) throws StorageFailureException {
        return acquire(key, true);
    }

    private Sector.Lease acquire(final SectorKey key, final boolean exclusive) throws StorageFailureException {
        while (true) {
            final CompletableFuture<Sector> future = sectors.computeIfAbsent(key, this::startLoad);
            final Sector sector;
            try {
                sector = future.join();
            } catch (final CompletionException e) {
                sectors.remove(key, future);
                throw new StorageFailureException("Failed to load sector " + key, e.getCause());
            }

            final Sector.Lease lease = exclusive ? sector.acquireExclusive() : sector.acquireShared();
            if (sector.isEvicted()) {
                lease.close();
                continue;
            }
            sector.touch(clock.incrementAndGet());
            return lease;
        }
    }

    private CompletableFuture<Sector> startLoad(final SectorKey key) {
        final Integer size = sectorSizes.get(key.boardId());
        if (size == null) {
            throw new IllegalStateException("Board " + key.boardId() + " is not registered with the sector cache");
        }
        final int length = size * key.kind().width();
        return CompletableFuture.supplyAsync(() -> load(key, length), ioExecutor);
    }

    private Sector load(final SectorKey key, final int length) {
        final Optional<byte[]> stored;
        try {
            stored = store.loadSector(key.boardId(), key.kind(), key.index());
        } catch (final StoreException e) {
            throw new CompletionException(e);
        }

        final byte[] data = new byte[length];
        stored.ifPresent(bytes -> {
            if (bytes.length != length) {
                LOGGER.warn("Stored sector {} has {} bytes, expected {}; adjusting", key, bytes.length, length);
            }
            System.arraycopy(bytes, 0, data, 0, Math.min(bytes.length, length));
        });

        final long bytesNow = residentBytes.addAndGet(length);
        final int countNow = residentCount.incrementAndGet();
        LOGGER.debug("Loaded sector {} ({}), {} sectors resident", key, stored.isPresent() ? "stored" : "new", countNow);
        if (countNow > config.maxResidentSectors() || bytesNow > config.maxResidentBytes()) {
            scheduleEviction();
        }
        return new Sector(key, data);
    }

    private void scheduleEviction() {
        if (evictionScheduled.compareAndSet(false, true)) {
            ioExecutor.execute(() -> {
                evictionScheduled.set(false);
                try {
                    evict();
                } catch (final StorageFailureException e) {
                    LOGGER.warn("Background eviction left dirty sectors resident: {}", e.getMessage());
                }
            });
        }
    }

    /**
     * Returns whether the resident set exceeds either limit.
     */
    public boolean isOverBudget() {
        return residentCount.get() > config.maxResidentSectors() || residentBytes.get() > config.maxResidentBytes();
    }

    public int residentSectors() {
        return residentCount.get();
    }

    public long residentBytes() {
        return residentBytes.get();
    }

    /**
     * Returns whether a sector is currently held in memory.
     */
    public boolean isResident(final SectorKey key) {
        final CompletableFuture<Sector> future = sectors.get(key);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Drops least-recently-used sectors until the cache is within budget. Dirty sectors are
     * written back first; sectors whose write-back fails stay resident and dirty.
     *
     * @throws StorageFailureException if any write-back failed. All other sectors are still processed.
     */
    public void evict() throws StorageFailureException {
        if (!isOverBudget()) {
            return;
        }
        final List<Sector> candidates = residentSnapshot();
        candidates.sort(Comparator.comparingLong(Sector::lastAccess));

        StorageFailureException failure = null;
        int evicted = 0;
        for (final Sector sector : candidates) {
            if (!isOverBudget()) {
                break;
            }
            if (!sector.tryLockFlush()) {
                continue;
            }
            try {
                if (!sector.tryLockExclusive()) {
                    continue;
                }
                try {
                    if (sector.isEvicted()) {
                        continue;
                    }
                    if (sector.isDirty()) {
                        final Sector.Snapshot snapshot = sector.snapshot();
                        try {
                            persist(sector.key(), snapshot);
                            sector.markPersisted(snapshot.version());
                        } catch (final StoreException e) {
                            LOGGER.warn("Failed to write back sector {} before eviction: {}", sector.key(), e.getMessage());
                            if (failure == null) {
                                failure = new StorageFailureException("Failed to write back sector " + sector.key(), e);
                            }
                            continue;
                        }
                    }
                    sector.markEvicted();
                    sectors.remove(sector.key());
                    residentBytes.addAndGet(-sector.length());
                    residentCount.decrementAndGet();
                    evicted++;
                } finally {
                    sector.unlockExclusive();
                }
            } finally {
                sector.unlockFlush();
            }
        }
        LOGGER.debug("Evicted {} sectors, {} resident", evicted, residentCount.get());
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Writes every dirty resident sector to the backing store.
     *
     * @throws StorageFailureException if any sector could not be written; all others are still written.
     */
    public void flushAll() throws StorageFailureException {
        StorageFailureException failure = null;
        int flushed = 0;
        for (final Sector sector : residentSnapshot()) {
            if (!sector.isDirty()) {
                continue;
            }
            sector.lockFlush();
            try {
                final Sector.Snapshot snapshot;
                try (Sector.Lease ignored = sector.acquireShared()) {
                    if (sector.isEvicted()) {
                        continue;
                    }
                    snapshot = sector.snapshot();
                }
                if (!sector.isAhead(snapshot)) {
                    continue;
                }
                persist(sector.key(), snapshot);
                sector.markPersisted(snapshot.version());
                flushed++;
            } catch (final StoreException e) {
                LOGGER.warn("Failed to flush sector {}: {}", sector.key(), e.getMessage());
                if (failure == null) {
                    failure = new StorageFailureException("Failed to flush sector " + sector.key(), e);
                }
            } finally {
                sector.unlockFlush();
            }
        }
        if (flushed > 0) {
            LOGGER.debug("Flushed {} dirty sectors", flushed);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Periodic maintenance: flushes dirty sectors, then evicts down to budget. Failures are
     * logged and retried on the next run.
     */
    public void checkpoint() {
        try {
            flushAll();
            evict();
        } catch (final StorageFailureException e) {
            LOGGER.warn("Sector checkpoint incomplete, retrying next run: {}", e.getMessage());
        }
    }

    private void persist(final SectorKey key, final Sector.Snapshot snapshot) throws StoreException {
        store.storeSector(key.boardId(), key.kind(), key.index(), snapshot.data());
    }

    private List<Sector> residentSnapshot() {
        final List<Sector> resident = new ArrayList<>();
        for (final CompletableFuture<Sector> future : sectors.values()) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                resident.add(future.join());
            }
        }
        return resident;
    }

    /**
     * Flushes all dirty sectors. Called on shutdown.
     */
    @Override
    public void close() {
        try {
            flushAll();
        } catch (final StorageFailureException e) {
            LOGGER.error("Sectors could not be flushed on shutdown", e);
        }
    }
}
