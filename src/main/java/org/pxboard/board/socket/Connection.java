package org.pxboard.board.socket;

import org.pxboard.access.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One socket client of one board.
 * <p>
 * Outbound frames go through a private queue drained on a shared executor, one frame at a
 * time, so frames reach the client in the order they were queued and a slow client only
 * delays itself. A client that falls more than {@code maxPendingFrames} behind is disconnected.
 * <p>
 * Lifecycle: {@code CONNECTED → SUBSCRIBED → CLOSED}; {@code CLOSED} is terminal and may be
 * entered from either state.
 */
public final class Connection {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);

    public enum State {
        CONNECTED, SUBSCRIBED, CLOSED
    }

    private final UUID id = UUID.randomUUID();
    private final int boardId;
    private final Set<Capability> capabilities;
    private final ConnectionSink sink;
    private final Executor sendExecutor;
    private final int maxPendingFrames;

    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTED);

    private volatile Identity identity;
    private volatile Future<?> handshakeTimeout;

    public Connection(final int boardId, final Set<Capability> capabilities, final ConnectionSink sink,
                      final Executor sendExecutor, final int maxPendingFrames) {
        this.boardId = boardId;
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        this.sink = sink;
        this.sendExecutor = sendExecutor;
        this.maxPendingFrames = maxPendingFrames;
    }

    public UUID id() {
        return id;
    }

    public int boardId() {
        return boardId;
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean has(final Capability capability) {
        return capabilities.contains(capability);
    }

    public State state() {
        return state.get();
    }

    public Optional<Identity> identity() {
        return Optional.ofNullable(identity);
    }

    void setIdentity(final Identity newIdentity) {
        this.identity = newIdentity;
    }

    void setHandshakeTimeout(final Future<?> timeout) {
        this.handshakeTimeout = timeout;
    }

    /**
     * Moves from {@code CONNECTED} to {@code SUBSCRIBED}.
     *
     * @return Whether the transition happened.
     */
    boolean markSubscribed() {
        final boolean subscribed = state.compareAndSet(State.CONNECTED, State.SUBSCRIBED);
        if (subscribed) {
            cancelHandshakeTimeout();
        }
        return subscribed;
    }

    /**
     * Queues a packet, filtered by this connection's capabilities.
     *
     * @return Whether a frame was queued.
     */
    public boolean send(final ServerPacket packet) {
        return PacketCodec.encodeFor(packet, capabilities).map(this::sendFrame).orElse(false);
    }

    /**
     * Queues an already encoded frame.
     *
     * @return Whether the frame was queued.
     */
    public boolean sendFrame(final String frame) {
        if (state.get() == State.CLOSED) {
            return false;
        }
        if (pending.incrementAndGet() > maxPendingFrames) {
            pending.decrementAndGet();
            LOGGER.warn("Connection {} fell {} frames behind, disconnecting", id, maxPendingFrames);
            close(CloseReason.SERVER_ERROR);
            return false;
        }
        outbound.add(frame);
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            sendExecutor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            String frame;
            while ((frame = outbound.poll()) != null) {
                pending.decrementAndGet();
                if (state.get() == State.CLOSED) {
                    continue;
                }
                try {
                    sink.send(frame);
                } catch (final IOException | RuntimeException e) {
                    LOGGER.debug("Send to connection {} failed, treating as disconnected: {}", id, e.getMessage());
                    markClosed();
                }
            }
        } finally {
            draining.set(false);
            if (!outbound.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    /**
     * Closes the connection from the server side.
     */
    public void close(final CloseReason reason) {
        if (markClosed()) {
            LOGGER.debug("Closing connection {} ({} {})", id, reason.code(), reason.reason());
            sink.close(reason.code(), reason.reason());
        }
    }

    /**
     * Records that the transport is gone. Queued frames are dropped.
     *
     * @return Whether this call performed the transition.
     */
    boolean markClosed() {
        final State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return false;
        }
        cancelHandshakeTimeout();
        outbound.clear();
        return true;
    }

    private void cancelHandshakeTimeout() {
        final Future<?> timeout = handshakeTimeout;
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", board=" + boardId + ", state=" + state.get() + '}';
    }
}
