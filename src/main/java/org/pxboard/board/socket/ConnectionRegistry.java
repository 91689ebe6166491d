package org.pxboard.board.socket;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open connections and which board each one is subscribed to.
 * <p>
 * Membership is kept in two maps, board to connection ids and id to connection, so that
 * neither side owns the other.
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public class ConnectionRegistry {

    private final Map<UUID, Connection> connections = new ConcurrentHashMap<>();
    private final Map<Integer, Set<UUID>> subscriptions = new ConcurrentHashMap<>();

    public void register(final Connection connection) {
        connections.put(connection.id(), connection);
    }

    public Optional<Connection> get(final UUID id) {
        return Optional.ofNullable(connections.get(id));
    }

    /**
     * Subscribes a registered connection to its board.
     *
     * @return Whether the connection was still open and is now subscribed.
     */
    public boolean subscribe(final Connection connection) {
        if (!connection.markSubscribed()) {
            return false;
        }
        subscriptions.computeIfAbsent(connection.boardId(), k -> ConcurrentHashMap.newKeySet()).add(connection.id());
        return true;
    }

    /**
     * Forgets a connection.
     *
     * @return Whether the connection was registered.
     */
    public boolean remove(final Connection connection) {
        connection.markClosed();
        subscriptions.computeIfPresent(connection.boardId(), (board, ids) -> {
            ids.remove(connection.id());
            return ids.isEmpty() ? null : ids;
        });
        return connections.remove(connection.id()) != null;
    }

    /**
     * Open connections subscribed to a board.
     */
    public List<Connection> subscribers(final int boardId) {
        final Set<UUID> ids = subscriptions.get(boardId);
        if (ids == null) {
            return List.of();
        }
        final List<Connection> result = new ArrayList<>(ids.size());
        for (final UUID id : ids) {
            final Connection connection = connections.get(id);
            if (connection != null && connection.state() == Connection.State.SUBSCRIBED) {
                result.add(connection);
            }
        }
        return result;
    }

    /**
     * Subscribed connections of one user on one board.
     */
    public List<Connection> userConnections(final int boardId, final String userId) {
        final List<Connection> result = new ArrayList<>();
        for (final Connection connection : subscribers(boardId)) {
            if (connection.identity().map(identity -> identity.userId().equals(userId)).orElse(false)) {
                result.add(connection);
            }
        }
        return result;
    }

    /**
     * Registered connections to a board in any state, including those still handshaking.
     */
    public List<Connection> boardConnections(final int boardId) {
        final List<Connection> result = new ArrayList<>();
        for (final Connection connection : connections.values()) {
            if (connection.boardId() == boardId) {
                result.add(connection);
            }
        }
        return result;
    }

    public List<Connection> all() {
        return new ArrayList<>(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
