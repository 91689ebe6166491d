package org.pxboard.board.cooldown;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * A user's pixel availability at a point in time.
 * <p>
 * Built from the ordered instants at which the user's pixels become (or became) available.
 * Every instant at or before {@code now} is a pixel the user may spend; the remaining instants
 * are when further pixels arrive. Spending pixels through {@link #consume()} advances a cursor
 * without touching the schedule.
 * <p>
 * <strong>Thread Safety:</strong> The schedule is immutable; {@link #consume()} is synchronized.
 */
public final class CooldownInfo {

    private final List<Instant> instants;
    private final Instant now;
    private final int reached;
    private int consumed;

    /**
     * @param instants Non-decreasing availability instants, one per pixel.
     * @param now      Evaluation time.
     * @throws IllegalArgumentException if the instants are not in order.
     */
    public CooldownInfo(final List<Instant> instants, final Instant now) {
        this.instants = List.copyOf(instants);
        this.now = now;
        int count = 0;
        for (int i = 0; i < this.instants.size(); i++) {
            final Instant instant = this.instants.get(i);
            if (i > 0 && instant.isBefore(this.instants.get(i - 1))) {
                throw new IllegalArgumentException("Cooldown instants must be non-decreasing: " + instants);
            }
            if (!instant.isAfter(now)) {
                count++;
            }
        }
        this.reached = count;
    }

    public List<Instant> instants() {
        return instants;
    }

    public Instant now() {
        return now;
    }

    /**
     * Pixels the user may place at {@link #now()}.
     */
    public synchronized int pixelsAvailable() {
        return Math.max(0, reached - consumed);
    }

    /**
     * The next instant after {@link #now()} at which a pixel arrives, if any.
     */
    public Optional<Instant> nextAvailable() {
        return reached < instants.size() ? Optional.of(instants.get(reached)) : Optional.empty();
    }

    /**
     * Spends one pixel.
     *
     * @return The instant at which the spent pixel had become available, or empty if none is left.
     */
    public synchronized Optional<Instant> consume() {
        if (consumed >= reached) {
            return Optional.empty();
        }
        return Optional.of(instants.get(consumed++));
    }

    /**
     * Future availability changes, in order. Each call starts a fresh sequence reflecting the
     * pixels consumed so far. Instants shared by several pixels are reported once with the
     * resulting count.
     */
    public synchronized Iterable<Availability> upcoming() {
        final int spent = consumed;
        return () -> new Iterator<>() {
            private int index = reached;

            @Override
            public boolean hasNext() {
                return index < instants.size();
            }

            @Override
            public Availability next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                final Instant instant = instants.get(index);
                while (index + 1 < instants.size() && instants.get(index + 1).equals(instant)) {
                    index++;
                }
                index++;
                return new Availability(instant, index - spent);
            }
        };
    }

    @Override
    public String toString() {
        return "CooldownInfo{available=" + pixelsAvailable() + ", next=" + nextAvailable().orElse(null) + '}';
    }

    /**
     * The pixel count a user reaches at an instant.
     */
    public record Availability(Instant instant, int pixelsAvailable) {
    }
}
