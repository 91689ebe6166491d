package org.pxboard.board;

import org.pxboard.access.IAuthenticator;
import org.pxboard.access.IPermissionEvaluator;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.board.sector.SectorCache;
import org.pxboard.board.socket.BoardSocketHandler;
import org.pxboard.board.socket.CloseReason;
import org.pxboard.board.socket.Connection;
import org.pxboard.board.socket.ConnectionRegistry;
import org.pxboard.board.socket.CooldownNotifier;
import org.pxboard.board.socket.UpdateDispatcher;
import org.pxboard.store.IBoardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns everything needed to serve boards: the store, the sector cache, the live boards,
 * socket bookkeeping and the threads behind them.
 * <p>
 * The runtime takes ownership of the store and closes it on {@link #close()}.
 */
public class BoardRuntime implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoardRuntime.class);

    private final IBoardStore store;
    private final IAuthenticator authenticator;
    private final IPermissionEvaluator permissions;
    private final BoardRuntimeConfig config;

    private final ExecutorService ioExecutor;
    private final ExecutorService fanoutExecutor;
    private final ScheduledExecutorService scheduler;

    private final SectorCache sectors;
    private final ConnectionRegistry connections;
    private final UpdateDispatcher dispatcher;
    private final CooldownNotifier notifier;
    private final BoardRegistry boards;
    private final BoardSocketHandler sockets;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public BoardRuntime(final IBoardStore store, final IAuthenticator authenticator,
                        final IPermissionEvaluator permissions, final BoardRuntimeConfig config, final Clock clock) {
        this.store = store;
        this.authenticator = authenticator;
        this.permissions = permissions;
        this.config = config;

        this.ioExecutor = Executors.newFixedThreadPool(config.cache().ioThreads(), daemonThreads("sector-io"));
        this.fanoutExecutor = Executors.newFixedThreadPool(config.fanoutThreads(), daemonThreads("socket-fanout"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("board-scheduler"));

        this.sectors = new SectorCache(store, config.cache(), ioExecutor);
        this.connections = new ConnectionRegistry();
        this.dispatcher = new UpdateDispatcher(connections);
        this.notifier = new CooldownNotifier(connections, scheduler, clock);
        this.boards = new BoardRegistry(new BoardContext(store, sectors, connections, dispatcher, notifier, clock, config));
        this.sockets = new BoardSocketHandler(boards, connections, authenticator, permissions, scheduler,
            fanoutExecutor, config.handshakeTimeout(), config.maxPendingFrames());
    }

    /**
     * Loads all boards and starts fan-out and periodic checkpoints.
     */
    public void start() throws StorageFailureException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        final int loaded = boards.loadAll();
        dispatcher.start();
        final long interval = config.cache().checkpointInterval().toMillis();
        scheduler.scheduleWithFixedDelay(sectors::checkpoint, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info("Board runtime started with {} boards, checkpoint every {}", loaded, config.cache().checkpointInterval());
    }

    public BoardRegistry boards() {
        return boards;
    }

    public BoardSocketHandler sockets() {
        return sockets;
    }

    public IAuthenticator authenticator() {
        return authenticator;
    }

    public IPermissionEvaluator permissions() {
        return permissions;
    }

    public SectorCache sectors() {
        return sectors;
    }

    public ConnectionRegistry connections() {
        return connections;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Closes all sockets, delivers pending updates and writes every dirty sector back.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (running.getAndSet(false)) {
            LOGGER.info("Stopping board runtime with {} open sockets", connections.size());
            dispatcher.close();
        }
        for (final Connection connection : connections.all()) {
            connection.close(CloseReason.SERVER_CLOSING);
            connections.remove(connection);
        }
        notifier.close();
        scheduler.shutdownNow();
        sectors.close();
        fanoutExecutor.shutdown();
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Sector I/O threads did not stop in time");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        store.close();
        LOGGER.info("Board runtime stopped");
    }

    private static ThreadFactory daemonThreads(final String prefix) {
        final AtomicInteger counter = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
