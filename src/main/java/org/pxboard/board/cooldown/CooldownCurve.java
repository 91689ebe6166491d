package org.pxboard.board.cooldown;

import java.time.Duration;

/**
 * How long it takes to regain pixels after a placement. Stack slot {@code n}, counted from 1,
 * is refilled {@code n * step} after the placement, whatever the stack held before it.
 */
public record CooldownCurve(Duration step) {

    public CooldownCurve {
        if (step.isNegative()) {
            throw new IllegalArgumentException("Cooldown step must not be negative");
        }
    }

    /**
     * Delay after a placement until the given stack slot is refilled.
     */
    public Duration delay(final int slot) {
        return step.multipliedBy(slot);
    }
}
