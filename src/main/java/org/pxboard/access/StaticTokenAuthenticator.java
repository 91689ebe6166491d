package org.pxboard.access;

import com.typesafe.config.Config;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticator with a fixed token table from configuration:
 * <pre>
 * tokens = [
 *   { token = "secret", user = "alice" }
 * ]
 * </pre>
 */
public class StaticTokenAuthenticator implements IAuthenticator {

    private final Map<String, Identity> identities = new HashMap<>();

    public StaticTokenAuthenticator(final Config options) {
        if (options.hasPath("tokens")) {
            for (final Config entry : options.getConfigList("tokens")) {
                identities.put(entry.getString("token"), new Identity(entry.getString("user")));
            }
        }
    }

    @Override
    public Optional<Identity> authenticate(final String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(identities.get(token));
    }
}
