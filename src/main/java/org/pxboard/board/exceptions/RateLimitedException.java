package org.pxboard.board.exceptions;

import org.pxboard.board.cooldown.CooldownInfo;

/**
 * Thrown when a user has no pixels available.
 * <p>
 * Carries the user's cooldown so callers can tell the client when to retry.
 */
public class RateLimitedException extends BoardException {

    private final transient CooldownInfo cooldown;

    public RateLimitedException(final CooldownInfo cooldown) {
        super("No pixels available");
        this.cooldown = cooldown;
    }

    public CooldownInfo getCooldown() {
        return cooldown;
    }
}
