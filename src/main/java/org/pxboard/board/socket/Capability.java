package org.pxboard.board.socket;

import org.pxboard.access.Permission;
import org.pxboard.board.exceptions.MalformedHandshakeException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Optional features a socket client negotiates when connecting.
 */
public enum Capability {
    /** Board info and color changes. */
    CORE("core", Permission.SOCKET_CORE),
    /** Authentication handshake and user-scoped pixel availability. */
    AUTHENTICATION("authentication", Permission.SOCKET_AUTHENTICATION),
    BOARD_TIMESTAMPS("board.timestamps", Permission.SOCKET_BOARD_TIMESTAMPS),
    BOARD_INITIAL("board.initial", Permission.SOCKET_BOARD_INITIAL),
    BOARD_MASK("board.mask", Permission.SOCKET_BOARD_MASK);

    private final String key;
    private final Permission permission;

    Capability(final String key, final Permission permission) {
        this.key = key;
        this.permission = permission;
    }

    public String key() {
        return key;
    }

    /** Permission required to negotiate this capability. */
    public Permission permission() {
        return permission;
    }

    /**
     * Parses the requested capability keys. No keys means {@link #CORE} only.
     *
     * @throws MalformedHandshakeException if a key is unknown.
     */
    public static Set<Capability> parse(final Collection<String> keys) throws MalformedHandshakeException {
        if (keys == null || keys.isEmpty()) {
            return EnumSet.of(CORE);
        }
        final Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (final String key : keys) {
            capabilities.add(fromKey(key));
        }
        return capabilities;
    }

    private static Capability fromKey(final String key) throws MalformedHandshakeException {
        for (final Capability capability : values()) {
            if (capability.key.equals(key)) {
                return capability;
            }
        }
        throw new MalformedHandshakeException("Unknown capability '" + key + "'");
    }
}
