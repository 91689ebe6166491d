package org.pxboard.board.socket;

import org.pxboard.board.cooldown.CooldownInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pushes {@code pixels-available} packets to a user's connections whenever their count changes.
 * <p>
 * For every user with a known schedule a timer fires at each upcoming availability instant.
 * A new schedule replaces the old timer; the timer is cancelled when the user's last connection
 * to the board goes away.
 */
public class CooldownNotifier implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CooldownNotifier.class);

    private final ConnectionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Map<UserKey, Timer> timers = new ConcurrentHashMap<>();

    public CooldownNotifier(final ConnectionRegistry registry, final ScheduledExecutorService scheduler, final Clock clock) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Sends the current availability to the user's connections and schedules pushes for the
     * upcoming changes. Does nothing if the user has no connections to the board.
     */
    public void update(final int boardId, final String userId, final CooldownInfo info) {
        final UserKey key = new UserKey(boardId, userId);
        final List<Connection> connections = registry.userConnections(boardId, userId);
        if (connections.isEmpty()) {
            cancel(boardId, userId);
            return;
        }
        final ServerPacket.PixelsAvailable packet = new ServerPacket.PixelsAvailable(
            info.pixelsAvailable(), info.nextAvailable().map(Instant::getEpochSecond).orElse(null));
        connections.forEach(connection -> connection.send(packet));

        final List<CooldownInfo.Availability> steps = new ArrayList<>();
        info.upcoming().forEach(steps::add);
        final Timer timer = new Timer(key, steps);
        final Timer previous = timers.put(key, timer);
        if (previous != null) {
            previous.cancel();
        }
        timer.scheduleStep(0);
    }

    /**
     * Stops pushing availability to a user.
     */
    public void cancel(final int boardId, final String userId) {
        final Timer timer = timers.remove(new UserKey(boardId, userId));
        if (timer != null) {
            timer.cancel();
        }
    }

    /**
     * Stops pushing availability to every user of a board.
     */
    public void cancelBoard(final int boardId) {
        timers.entrySet().removeIf(entry -> {
            if (entry.getKey().boardId() != boardId) {
                return false;
            }
            entry.getValue().cancel();
            return true;
        });
    }

    /**
     * Number of users with a running timer.
     */
    public int activeTimers() {
        return timers.size();
    }

    @Override
    public void close() {
        timers.values().forEach(Timer::cancel);
        timers.clear();
    }

    private record UserKey(int boardId, String userId) {
    }

    private final class Timer {

        private final UserKey key;
        private final List<CooldownInfo.Availability> steps;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        Timer(final UserKey key, final List<CooldownInfo.Availability> steps) {
            this.key = key;
            this.steps = steps;
        }

        void scheduleStep(final int index) {
            if (cancelled) {
                return;
            }
            if (index >= steps.size()) {
                timers.remove(key, this);
                return;
            }
            final CooldownInfo.Availability step = steps.get(index);
            final long delay = Math.max(0, Duration.between(clock.instant(), step.instant()).toMillis());
            future = scheduler.schedule(() -> fire(index), delay, TimeUnit.MILLISECONDS);
        }

        private void fire(final int index) {
            if (cancelled) {
                return;
            }
            final CooldownInfo.Availability step = steps.get(index);
            final Long next = index + 1 < steps.size() ? steps.get(index + 1).instant().getEpochSecond() : null;
            final ServerPacket.PixelsAvailable packet = new ServerPacket.PixelsAvailable(step.pixelsAvailable(), next);
            final List<Connection> connections = registry.userConnections(key.boardId(), key.userId());
            connections.forEach(connection -> connection.send(packet));
            LOGGER.debug("User '{}' on board {} now has {} pixels", key.userId(), key.boardId(), step.pixelsAvailable());
            scheduleStep(index + 1);
        }

        void cancel() {
            cancelled = true;
            final ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
