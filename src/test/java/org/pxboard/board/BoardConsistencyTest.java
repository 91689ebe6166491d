package org.pxboard.board;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pxboard.access.Identity;
import org.pxboard.board.exceptions.StorageFailureException;
import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.MaskValue;
import org.pxboard.board.sector.SectorCache;
import org.pxboard.board.sector.SectorCacheConfig;
import org.pxboard.board.socket.Capability;
import org.pxboard.board.socket.Change;
import org.pxboard.board.socket.Connection;
import org.pxboard.board.socket.ConnectionRegistry;
import org.pxboard.board.socket.CooldownNotifier;
import org.pxboard.board.socket.RecordingSink;
import org.pxboard.board.socket.ServerPacket;
import org.pxboard.board.socket.UpdateDispatcher;
import org.pxboard.junit.extensions.logging.LogWatchExtension;
import org.pxboard.store.H2BoardStore;
import org.pxboard.store.IBoardStore;
import org.pxboard.store.StoreException;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * Ordering and atomicity of board writes as seen by the store and by subscribers, with the
 * board's collaborators wired by hand so they can be replaced.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class BoardConsistencyTest {

    private static final Identity ALICE = new Identity("alice");
    private static final Identity BOB = new Identity("bob");

    private final BoardRuntimeConfig config = new BoardRuntimeConfig(
        Duration.ofSeconds(30),
        Duration.ofSeconds(10),
        Duration.ofMinutes(5),
        Duration.ofSeconds(5),
        2,
        256,
        new SectorCacheConfig(64, 1 << 20, Duration.ofMinutes(10), 2));

    private MutableClock clock;
    private ExecutorService ioPool;
    private ScheduledExecutorService scheduler;
    private H2BoardStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(RuntimeFixture.START);
        ioPool = Executors.newFixedThreadPool(2);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        store = spy(RuntimeFixture.store(RuntimeFixture.newJdbcUrl()));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        ioPool.shutdownNow();
        store.close();
    }

    private Board openBoard(final IBoardStore boardStore, final ConnectionRegistry connections,
                            final UpdateDispatcher dispatcher) throws Exception {
        final SectorCache sectors = new SectorCache(boardStore, config.cache(), ioPool);
        final BoardContext context = new BoardContext(boardStore, sectors, connections, dispatcher,
            new CooldownNotifier(connections, scheduler, clock), clock, config);
        final BoardInfo info = boardStore.createBoard("consistency", clock.instant(), RuntimeFixture.SHAPE,
            RuntimeFixture.PALETTE, 3, 3);
        final Board board = Board.load(info, context);
        final byte[] mask = new byte[(int) RuntimeFixture.SHAPE.totalSize()];
        Arrays.fill(mask, (byte) MaskValue.PLACE.value());
        board.patch(BufferKind.MASK, 0, mask);
        clock.advance(Duration.ofHours(1));
        return board;
    }

    @Test
    @DisplayName("Subscribers see concurrent placements on one pixel in commit order")
    void samePixelUpdatesFanOutInCommitOrder() throws Exception {
        final ConnectionRegistry connections = new ConnectionRegistry();
        final StallingDispatcher dispatcher = new StallingDispatcher(connections);
        final Board board = openBoard(store, connections, dispatcher);

        final ExecutorService placers = Executors.newFixedThreadPool(2);
        try {
            final Future<PlacementResult> first = placers.submit(() -> board.place(ALICE, 5, 1));
            assertThat(dispatcher.publishing.await(5, TimeUnit.SECONDS)).isTrue();
            final Future<PlacementResult> second = placers.submit(() -> board.place(BOB, 5, 2));

            final PlacementResult firstResult = first.get(5, TimeUnit.SECONDS);
            final PlacementResult secondResult = second.get(5, TimeUnit.SECONDS);

            assertThat(secondResult.placement().id()).isGreaterThan(firstResult.placement().id());
            assertThat(dispatcher.publishedColors).containsExactly(1L, 2L);
            assertThat(board.read(BufferKind.COLORS, 5, 6)).containsExactly(2);
        } finally {
            placers.shutdownNow();
        }
    }

    @Test
    @DisplayName("A placement whose timestamp sector cannot be loaded leaves no trace")
    void failedTimestampLoadDoesNotHalfApply() throws Exception {
        final ConnectionRegistry connections = new ConnectionRegistry();
        final RecordingDispatcher dispatcher = new RecordingDispatcher(connections);
        final Board board = openBoard(store, connections, dispatcher);
        doThrow(new StoreException("timestamps unavailable", null))
            .when(store).loadSector(anyInt(), eq(BufferKind.TIMESTAMPS), anyInt());

        assertThatThrownBy(() -> board.place(ALICE, 5, 2)).isInstanceOf(StorageFailureException.class);

        assertThat(board.read(BufferKind.COLORS, 5, 6)).containsExactly(0);
        assertThat(board.lookup(5)).isEmpty();
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(3);
        assertThat(board.activeUsers()).isZero();
        assertThat(dispatcher.colorUpdates).isEmpty();

        doCallRealMethod().when(store).loadSector(anyInt(), eq(BufferKind.TIMESTAMPS), anyInt());
        board.place(ALICE, 5, 2);

        assertThat(board.read(BufferKind.COLORS, 5, 6)).containsExactly(2);
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(2);
        assertThat(dispatcher.colorUpdates).hasSize(1);
    }

    @Test
    @DisplayName("ready is the first frame even if an update is fanned out the moment the socket subscribes")
    void readyPrecedesUpdatesRacingTheSubscription() throws Exception {
        final PublishingOnSubscribeRegistry connections = new PublishingOnSubscribeRegistry();
        final UpdateDispatcher dispatcher = new UpdateDispatcher(connections);
        connections.dispatcher = dispatcher;
        final Board board = openBoard(store, connections, dispatcher);
        dispatcher.flush();

        final RecordingSink sink = new RecordingSink();
        final Connection connection = new Connection(board.id(), EnumSet.of(Capability.CORE), sink, Runnable::run, 16);
        connections.register(connection);

        assertThat(board.subscribe(connection)).isTrue();

        assertThat(sink.frames()).hasSize(2);
        assertThat(sink.frames().get(0)).isEqualTo("{\"type\":\"ready\"}");
        assertThat(sink.frames().get(1)).contains("board-update");
    }

    /**
     * Holds the first color update inside {@code publish} until a second one arrives or a
     * short grace period passes, recording the order in which updates were handed over.
     */
    private static final class StallingDispatcher extends UpdateDispatcher {

        private final CountDownLatch publishing = new CountDownLatch(1);
        private final CountDownLatch secondArrived = new CountDownLatch(1);
        private final AtomicInteger colorPublishes = new AtomicInteger();
        private final List<Long> publishedColors = new CopyOnWriteArrayList<>();

        StallingDispatcher(final ConnectionRegistry registry) {
            super(registry);
        }

        @Override
        public void publish(final int boardId, final ServerPacket.BoardUpdate update) {
            final List<Change> colors = update.data() == null ? null : update.data().colors();
            if (colors != null) {
                if (colorPublishes.getAndIncrement() == 0) {
                    publishing.countDown();
                    try {
                        secondArrived.await(500, TimeUnit.MILLISECONDS);
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                } else {
                    secondArrived.countDown();
                }
                publishedColors.add(colors.get(0).values()[0]);
            }
            super.publish(boardId, update);
        }
    }

    private static final class RecordingDispatcher extends UpdateDispatcher {

        private final List<ServerPacket.BoardUpdate> colorUpdates = new CopyOnWriteArrayList<>();

        RecordingDispatcher(final ConnectionRegistry registry) {
            super(registry);
        }

        @Override
        public void publish(final int boardId, final ServerPacket.BoardUpdate update) {
            if (update.data() != null && update.data().colors() != null) {
                colorUpdates.add(update);
            }
            super.publish(boardId, update);
        }
    }

    /**
     * Fans out a pixel change right after a connection becomes visible to subscribers.
     */
    private static final class PublishingOnSubscribeRegistry extends ConnectionRegistry {

        private UpdateDispatcher dispatcher;

        @Override
        public boolean subscribe(final Connection connection) {
            final boolean subscribed = super.subscribe(connection);
            if (subscribed) {
                dispatcher.publish(connection.boardId(), ServerPacket.BoardUpdate.ofData(new ServerPacket.BoardData(
                    List.of(Change.single(1, 3)), null, null, null)));
                dispatcher.flush();
            }
            return subscribed;
        }
    }
}
