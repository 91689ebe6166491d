package org.pxboard.access;

import java.util.Optional;

/**
 * Resolves bearer tokens to identities.
 */
public interface IAuthenticator {

    /**
     * @return The identity the token belongs to, or empty if the token is not valid.
     */
    Optional<Identity> authenticate(String token);
}
