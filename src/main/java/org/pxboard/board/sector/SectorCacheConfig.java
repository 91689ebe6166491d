package org.pxboard.board.sector;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Residency limits and checkpoint schedule of a {@link SectorCache}.
 *
 * @param maxResidentSectors Maximum number of resident sectors.
 * @param maxResidentBytes   Maximum total size of resident sectors.
 * @param checkpointInterval Interval between flush-and-evict runs.
 * @param ioThreads          Threads loading sectors from the backing store.
 */
public record SectorCacheConfig(int maxResidentSectors, long maxResidentBytes, Duration checkpointInterval, int ioThreads) {

    public SectorCacheConfig {
        if (maxResidentSectors < 1 || maxResidentBytes < 1) {
            throw new IllegalArgumentException("Sector cache limits must be positive");
        }
        if (checkpointInterval.isNegative() || checkpointInterval.isZero()) {
            throw new IllegalArgumentException("Checkpoint interval must be positive");
        }
        if (ioThreads < 1) {
            throw new IllegalArgumentException("At least one I/O thread is required");
        }
    }

    /**
     * Reads the {@code cache} block of the board runtime options.
     */
    public static SectorCacheConfig fromConfig(final Config config) {
        return new SectorCacheConfig(
            config.getInt("max-resident-sectors"),
            config.getBytes("max-resident-bytes"),
            config.getDuration("checkpoint-interval"),
            config.getInt("io-threads"));
    }
}
