package org.pxboard.board.cooldown;

import org.pxboard.board.exceptions.StorageFailureException;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user recent placement history of one board.
 * <p>
 * A user's history is loaded from the backing store on first use and then maintained in
 * memory as placements are made and undone. Only the most recent {@code limit} placements
 * are kept since older ones cannot affect the cooldown.
 */
public class CooldownCache {

    /**
     * Loads the most recent placement instants of a user, oldest first.
     */
    @FunctionalInterface
    public interface HistoryLoader {
        List<Instant> load(String userId, int limit) throws StorageFailureException;
    }

    private final HistoryLoader loader;
    private final Map<String, UserHistory> users = new ConcurrentHashMap<>();
    private volatile int limit;

    public CooldownCache(final HistoryLoader loader, final int limit) {
        this.loader = loader;
        this.limit = limit;
    }

    /**
     * Returns the history holder of a user. Callers serialize compound updates by
     * synchronizing on the returned object.
     */
    public UserHistory user(final String userId) {
        return users.computeIfAbsent(userId, UserHistory::new);
    }

    /**
     * Changes the number of placements kept and drops everything cached.
     */
    public void resize(final int newLimit) {
        this.limit = newLimit;
        users.clear();
    }

    public int limit() {
        return limit;
    }

    /**
     * Recent placements of a single user.
     */
    public final class UserHistory {

        private final String userId;
        private final Deque<Instant> placements = new ArrayDeque<>();
        private boolean loaded;

        private UserHistory(final String userId) {
            this.userId = userId;
        }

        public String userId() {
            return userId;
        }

        /**
         * Returns the placements, oldest first, loading them on first access.
         */
        public synchronized List<Instant> placements() throws StorageFailureException {
            if (!loaded) {
                placements.addAll(loader.load(userId, limit));
                loaded = true;
            }
            return new ArrayList<>(placements);
        }

        /**
         * Appends a placement. Ignored until the history was loaded, since the load will include it.
         */
        public synchronized void add(final Instant placedAt) {
            if (!loaded) {
                return;
            }
            placements.addLast(placedAt);
            while (placements.size() > limit) {
                placements.removeFirst();
            }
        }

        /**
         * Forces a reload from the backing store on next access.
         */
        public synchronized void invalidate() {
            placements.clear();
            loaded = false;
        }
    }
}
