package org.pxboard.board.socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Delivers board updates to subscribed connections.
 * <p>
 * Published updates are queued and handled by a single dispatcher thread. Each run takes
 * everything queued, merges it per board, encodes the result once per distinct capability
 * set among the subscribers, and hands the frames to the connections' outbound queues.
 * Publishing never blocks on delivery.
 */
public class UpdateDispatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpdateDispatcher.class);

    private final ConnectionRegistry registry;
    private final BlockingQueue<Queued> queue = new LinkedBlockingQueue<>();
    private volatile Thread thread;
    private volatile boolean running;

    public UpdateDispatcher(final ConnectionRegistry registry) {
        this.registry = registry;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::run, "update-dispatcher");
        thread.setDaemon(true);
        thread.start();
        LOGGER.debug("Update dispatcher started");
    }

    /**
     * Queues an update for a board's subscribers.
     */
    public void publish(final int boardId, final ServerPacket.BoardUpdate update) {
        if (!update.isEmpty()) {
            queue.add(new Queued(boardId, update));
        }
    }

    private void run() {
        while (running) {
            try {
                final Queued first = queue.poll(100, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                final List<Queued> batch = new ArrayList<>();
                batch.add(first);
                queue.drainTo(batch);
                dispatch(batch);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to dispatch board updates", e);
            }
        }
    }

    /**
     * Merges and delivers a batch. Runs on the dispatcher thread; also used directly by
     * {@link #flush()}.
     */
    void dispatch(final List<Queued> batch) {
        final Map<Integer, BoardUpdateBuilder> perBoard = new LinkedHashMap<>();
        for (final Queued queued : batch) {
            perBoard.computeIfAbsent(queued.boardId(), k -> new BoardUpdateBuilder()).merge(queued.update());
        }
        perBoard.forEach((boardId, builder) -> deliver(boardId, builder.build()));
    }

    private void deliver(final int boardId, final ServerPacket.BoardUpdate update) {
        final Map<Set<Capability>, Optional<String>> frames = new HashMap<>();
        int sent = 0;
        for (final Connection connection : registry.subscribers(boardId)) {
            final Optional<String> frame = frames.computeIfAbsent(connection.capabilities(),
                capabilities -> PacketCodec.encodeFor(update, capabilities));
            if (frame.isPresent() && connection.sendFrame(frame.get())) {
                sent++;
            }
        }
        LOGGER.debug("Board {} update queued for {} connections ({} encodings)", boardId, sent, frames.size());
    }

    /**
     * Delivers everything queued so far on the calling thread.
     */
    public void flush() {
        final List<Queued> batch = new ArrayList<>();
        queue.drainTo(batch);
        if (!batch.isEmpty()) {
            dispatch(batch);
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        final Thread current = thread;
        if (current != null) {
            current.interrupt();
            try {
                current.join(1000);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
        flush();
        LOGGER.debug("Update dispatcher stopped");
    }

    record Queued(int boardId, ServerPacket.BoardUpdate update) {
    }
}
