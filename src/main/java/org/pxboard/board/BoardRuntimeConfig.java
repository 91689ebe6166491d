package org.pxboard.board;

import com.typesafe.config.Config;
import org.pxboard.board.sector.SectorCacheConfig;

import java.time.Duration;

/**
 * Tunables of the board runtime, read from the {@code board-runtime} process options.
 *
 * @param cooldownStep     Time to regain one pixel.
 * @param undoDeadline     How long after a placement it may be undone.
 * @param idleTimeout      How long after a placement a user counts as active.
 * @param handshakeTimeout Time a socket client has to authenticate.
 * @param fanoutThreads    Threads writing frames to socket clients.
 * @param maxPendingFrames Frames a socket client may fall behind before it is dropped.
 * @param cache            Sector cache limits.
 */
public record BoardRuntimeConfig(Duration cooldownStep, Duration undoDeadline, Duration idleTimeout,
                                 Duration handshakeTimeout, int fanoutThreads, int maxPendingFrames,
                                 SectorCacheConfig cache) {

    public static BoardRuntimeConfig fromConfig(final Config options) {
        return new BoardRuntimeConfig(
            options.getDuration("cooldown.step"),
            options.getDuration("cooldown.undo-deadline"),
            options.getDuration("activity.idle-timeout"),
            options.getDuration("sockets.handshake-timeout"),
            options.getInt("sockets.fanout-threads"),
            options.getInt("sockets.max-pending-frames"),
            SectorCacheConfig.fromConfig(options.getConfig("cache")));
    }
}
