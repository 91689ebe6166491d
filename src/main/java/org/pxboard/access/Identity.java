package org.pxboard.access;

import java.util.Objects;

/**
 * An authenticated user.
 *
 * @param userId Stable user identifier.
 */
public record Identity(String userId) {

    public Identity {
        Objects.requireNonNull(userId, "userId");
    }
}
