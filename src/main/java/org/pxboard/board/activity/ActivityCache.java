package org.pxboard.board.activity;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Counts distinct users who placed within a sliding idle window.
 * <p>
 * Entries are kept in insertion order, which is also timestamp order. Counting trims the
 * entries that fell out of the window and recomputes the distinct count only when the
 * contents changed since the last count.
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public class ActivityCache {

    private final long idleTimeoutSeconds;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private final Map<String, Integer> occurrences = new HashMap<>();

    private long lastTimestamp = Long.MIN_VALUE;
    private boolean dirty;
    private int cachedCount;

    /**
     * @param idleTimeoutSeconds How long after a placement a user still counts as active.
     */
    public ActivityCache(final long idleTimeoutSeconds) {
        if (idleTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Idle timeout must not be negative");
        }
        this.idleTimeoutSeconds = idleTimeoutSeconds;
    }

    public long idleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    /**
     * Records a placement.
     *
     * @throws IllegalArgumentException if the timestamp is older than the last inserted one.
     */
    public synchronized void insert(final long timestamp, final String userId) {
        if (timestamp < lastTimestamp) {
            throw new IllegalArgumentException("Activity timestamp " + timestamp + " precedes " + lastTimestamp);
        }
        append(timestamp, timestamp, userId);
    }

    /**
     * Records a placement that may have been committed just before the last recorded one.
     * It is queued at {@code max(timestamp, lastTimestamp)} so the queue stays ordered, and
     * {@link #remove(long, String)} still finds it by its own timestamp.
     */
    public synchronized void insertLate(final long timestamp, final String userId) {
        append(timestamp, Math.max(timestamp, lastTimestamp), userId);
    }

    private void append(final long placedAt, final long queuedAt, final String userId) {
        lastTimestamp = queuedAt;
        entries.addLast(new Entry(queuedAt, placedAt, userId));
        occurrences.merge(userId, 1, Integer::sum);
        dirty = true;
    }

    /**
     * Removes one entry matching both placement timestamp and user, e.g. after an undo.
     *
     * @return Whether an entry was removed.
     */
    public synchronized boolean remove(final long timestamp, final String userId) {
        final Iterator<Entry> it = entries.descendingIterator();
        while (it.hasNext()) {
            final Entry entry = it.next();
            if (entry.placedAt == timestamp && entry.userId.equals(userId)) {
                it.remove();
                decrement(userId);
                dirty = true;
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the number of distinct users with a placement newer than {@code now - idleTimeout}.
     */
    public synchronized int count(final long now) {
        final long cutoff = now - idleTimeoutSeconds;
        while (!entries.isEmpty() && entries.peekFirst().timestamp < cutoff) {
            decrement(entries.pollFirst().userId);
            dirty = true;
        }
        if (dirty) {
            cachedCount = occurrences.size();
            dirty = false;
        }
        return cachedCount;
    }

    /**
     * Latest inserted timestamp, or {@link Long#MIN_VALUE} if nothing was inserted.
     */
    public synchronized long lastTimestamp() {
        return lastTimestamp;
    }

    private void decrement(final String userId) {
        occurrences.computeIfPresent(userId, (k, v) -> v > 1 ? v - 1 : null);
    }

    private record Entry(long timestamp, long placedAt, String userId) {
    }
}
