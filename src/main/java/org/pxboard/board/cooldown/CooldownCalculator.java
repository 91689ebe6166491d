package org.pxboard.board.cooldown;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives a user's availability schedule from their recent placements.
 * <p>
 * The user is assumed to hold a full stack before the oldest placement considered. Walking
 * forward, the stack left after each placement is the number of pixels available at that
 * moment minus the one spent. The schedule after the last placement starts with the leftover
 * stack, already available. Each empty stack slot above it is refilled at the delay the
 * {@link CooldownCurve} gives that slot, so refilling a deeper stack takes longer.
 * Only the last {@code limit} placements can influence the result, so older history is ignored.
 */
public class CooldownCalculator {

    private final CooldownCurve curve;

    public CooldownCalculator(final CooldownCurve curve) {
        this.curve = curve;
    }

    /**
     * @param history Placement instants, oldest first.
     * @param limit   Maximum number of pixels a user can hold.
     * @param now     Evaluation time.
     */
    public CooldownInfo compute(final List<Instant> history, final int limit, final Instant now) {
        return new CooldownInfo(schedule(history, limit), now);
    }

    /**
     * Returns the ordered availability instants for the given history.
     */
    public List<Instant> schedule(final List<Instant> history, final int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (history.isEmpty()) {
            return Collections.nCopies(limit, Instant.EPOCH);
        }

        final List<Instant> relevant = history.subList(Math.max(0, history.size() - limit), history.size());
        List<Instant> current = null;
        for (final Instant placedAt : relevant) {
            final int available = current == null ? limit : countReached(current, placedAt);
            final int stack = Math.max(0, available - 1);
            current = scheduleFrom(placedAt, stack, limit);
        }
        return current;
    }

    private List<Instant> scheduleFrom(final Instant base, final int stack, final int limit) {
        final List<Instant> instants = new ArrayList<>(limit);
        for (int k = 0; k < limit; k++) {
            instants.add(k < stack ? base : base.plus(curve.delay(k + 1)));
        }
        return instants;
    }

    private static int countReached(final List<Instant> instants, final Instant at) {
        int count = 0;
        for (final Instant instant : instants) {
            if (instant.isAfter(at)) {
                break;
            }
            count++;
        }
        return count;
    }
}
