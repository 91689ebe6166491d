package org.pxboard.board.socket;

import org.pxboard.access.IAuthenticator;
import org.pxboard.access.IPermissionEvaluator;
import org.pxboard.access.Identity;
import org.pxboard.board.Board;
import org.pxboard.board.BoardRegistry;
import org.pxboard.board.exceptions.BoardNotFoundException;
import org.pxboard.board.exceptions.MalformedHandshakeException;
import org.pxboard.board.exceptions.StorageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Transport-independent handling of board event sockets.
 * <p>
 * A client names its capabilities when connecting. Without {@link Capability#AUTHENTICATION}
 * it is checked against the anonymous permissions and subscribed at once. With it, the first
 * packet must be {@code authenticate} and arrive within the handshake timeout; later
 * {@code authenticate} packets refresh the credentials of the same user.
 */
public class BoardSocketHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardSocketHandler.class);

    private final BoardRegistry boards;
    private final ConnectionRegistry connections;
    private final IAuthenticator authenticator;
    private final IPermissionEvaluator permissions;
    private final ScheduledExecutorService scheduler;
    private final Executor sendExecutor;
    private final Duration handshakeTimeout;
    private final int maxPendingFrames;

    public BoardSocketHandler(final BoardRegistry boards, final ConnectionRegistry connections,
                              final IAuthenticator authenticator, final IPermissionEvaluator permissions,
                              final ScheduledExecutorService scheduler, final Executor sendExecutor,
                              final Duration handshakeTimeout, final int maxPendingFrames) {
        this.boards = boards;
        this.connections = connections;
        this.authenticator = authenticator;
        this.permissions = permissions;
        this.scheduler = scheduler;
        this.sendExecutor = sendExecutor;
        this.handshakeTimeout = handshakeTimeout;
        this.maxPendingFrames = maxPendingFrames;
    }

    /**
     * Admits a new socket.
     *
     * @param boardId      Board the client wants to follow.
     * @param capabilities Requested capability keys; empty means core only.
     * @param sink         Transport of the socket.
     * @return The connection, or empty if the socket was rejected and closed.
     */
    public Optional<Connection> onConnect(final int boardId, final Collection<String> capabilities,
                                          final ConnectionSink sink) {
        final Board board;
        final Set<Capability> negotiated;
        try {
            board = boards.get(boardId);
            negotiated = Capability.parse(capabilities);
        } catch (final BoardNotFoundException | MalformedHandshakeException e) {
            LOGGER.debug("Rejected socket for board {}: {}", boardId, e.getMessage());
            sink.close(CloseReason.INVALID_PACKET.code(), CloseReason.INVALID_PACKET.reason());
            return Optional.empty();
        }

        final Connection connection = new Connection(boardId, negotiated, sink, sendExecutor, maxPendingFrames);
        connections.register(connection);

        if (connection.has(Capability.AUTHENTICATION)) {
            connection.setHandshakeTimeout(scheduler.schedule(
                () -> rejectIfWaiting(connection), handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS));
            LOGGER.debug("{} waiting for authentication", connection);
        } else if (authorized(connection, null)) {
            admit(board, connection);
        }
        return connections.get(connection.id());
    }

    /**
     * Handles a text frame from a client.
     */
    public void onMessage(final UUID connectionId, final String text) {
        final Optional<Connection> found = connections.get(connectionId);
        if (found.isEmpty()) {
            return;
        }
        final Connection connection = found.get();

        final ClientPacket packet;
        try {
            packet = PacketCodec.decode(text);
        } catch (final MalformedHandshakeException e) {
            LOGGER.debug("{} sent an invalid packet: {}", connection, e.getMessage());
            reject(connection, CloseReason.INVALID_PACKET);
            return;
        }

        if (packet instanceof ClientPacket.Authenticate) {
            authenticate(connection, ((ClientPacket.Authenticate) packet).token());
        } else {
            reject(connection, CloseReason.INVALID_PACKET);
        }
    }

    private void authenticate(final Connection connection, final String token) {
        if (!connection.has(Capability.AUTHENTICATION)) {
            reject(connection, CloseReason.INVALID_PACKET);
            return;
        }

        final Identity identity;
        if (token == null) {
            identity = null;
        } else {
            final Optional<Identity> resolved = authenticator.authenticate(token);
            if (resolved.isEmpty()) {
                reject(connection, CloseReason.INVALID_TOKEN);
                return;
            }
            identity = resolved.get();
        }

        if (connection.state() == Connection.State.SUBSCRIBED) {
            reauthenticate(connection, identity);
            return;
        }
        if (!authorized(connection, identity)) {
            return;
        }
        connection.setIdentity(identity);
        try {
            admit(boards.get(connection.boardId()), connection);
        } catch (final BoardNotFoundException e) {
            reject(connection, CloseReason.SERVER_ERROR);
        }
    }

    private void reauthenticate(final Connection connection, final Identity identity) {
        final Optional<Identity> current = connection.identity();
        if (current.isEmpty()) {
            reject(connection, CloseReason.INVALID_PACKET);
            return;
        }
        if (identity == null || !Objects.equals(current.get().userId(), identity.userId())) {
            reject(connection, CloseReason.INVALID_TOKEN);
            return;
        }
        if (!authorized(connection, identity)) {
            return;
        }
        connection.setIdentity(identity);
        LOGGER.debug("{} refreshed its credentials", connection);
        try {
            boards.get(connection.boardId()).refreshCooldown(identity);
        } catch (final BoardNotFoundException | StorageFailureException e) {
            LOGGER.warn("Could not refresh pixel availability for {}: {}", connection, e.getMessage());
        }
    }

    private boolean authorized(final Connection connection, final Identity identity) {
        for (final Capability capability : connection.capabilities()) {
            if (!permissions.hasPermission(identity, capability.permission())) {
                LOGGER.debug("{} lacks permission {}", connection, capability.permission().key());
                reject(connection, CloseReason.MISSING_PERMISSION);
                return false;
            }
        }
        return true;
    }

    private void admit(final Board board, final Connection connection) {
        try {
            if (!board.subscribe(connection)) {
                connections.remove(connection);
            }
        } catch (final StorageFailureException e) {
            LOGGER.warn("Could not subscribe {}: {}", connection, e.getMessage());
            board.unsubscribe(connection);
            connection.close(CloseReason.SERVER_ERROR);
        }
    }

    private void rejectIfWaiting(final Connection connection) {
        if (connection.state() == Connection.State.CONNECTED) {
            LOGGER.debug("{} did not authenticate in time", connection);
            reject(connection, CloseReason.AUTH_TIMEOUT);
        }
    }

    private void reject(final Connection connection, final CloseReason reason) {
        connection.close(reason);
        onClose(connection.id());
    }

    /**
     * Forgets a socket that was closed by either side.
     */
    public void onClose(final UUID connectionId) {
        final Optional<Connection> found = connections.get(connectionId);
        if (found.isEmpty()) {
            return;
        }
        final Connection connection = found.get();
        try {
            boards.get(connection.boardId()).unsubscribe(connection);
        } catch (final BoardNotFoundException e) {
            connections.remove(connection);
        }
        LOGGER.debug("{} closed", connection);
    }
}
