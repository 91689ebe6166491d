package org.pxboard.access;

import java.util.Optional;

/**
 * Actions subject to authorization. Each permission has the key used in configuration.
 */
public enum Permission {
    BOARDS_LIST("boards.list"),
    BOARDS_GET("boards.get"),
    BOARDS_POST("boards.post"),
    BOARDS_PATCH("boards.patch"),
    BOARDS_DELETE("boards.delete"),
    BOARDS_DATA_GET("boards.data.get"),
    BOARDS_DATA_PATCH("boards.data.patch"),
    BOARDS_USERS_GET("boards.users.get"),
    BOARDS_PIXELS_LIST("boards.pixels.list"),
    BOARDS_PIXELS_GET("boards.pixels.get"),
    BOARDS_PIXELS_POST("boards.pixels.post"),
    BOARDS_PIXELS_UNDO("boards.pixels.undo"),
    BOARDS_COOLDOWN_GET("boards.cooldown.get"),
    SOCKET_CORE("socket.core"),
    SOCKET_AUTHENTICATION("socket.authentication"),
    SOCKET_BOARD_TIMESTAMPS("socket.board.timestamps"),
    SOCKET_BOARD_INITIAL("socket.board.initial"),
    SOCKET_BOARD_MASK("socket.board.mask");

    private final String key;

    Permission(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Permission> fromKey(final String key) {
        for (final Permission permission : values()) {
            if (permission.key.equals(key)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
