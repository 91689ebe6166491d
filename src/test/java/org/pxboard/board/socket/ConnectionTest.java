package org.pxboard.board.socket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pxboard.junit.extensions.logging.ExpectLog;
import org.pxboard.junit.extensions.logging.LogLevel;
import org.pxboard.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConnectionTest {

    private static Connection connection(final ConnectionSink sink, final List<Runnable> tasks, final int maxPending) {
        return new Connection(1, EnumSet.of(Capability.CORE), sink, tasks::add, maxPending);
    }

    private static void runAll(final List<Runnable> tasks) {
        while (!tasks.isEmpty()) {
            tasks.remove(0).run();
        }
    }

    @Test
    void framesArriveInOrder() {
        final RecordingSink sink = new RecordingSink();
        final List<Runnable> tasks = new ArrayList<>();
        final Connection connection = connection(sink, tasks, 16);

        connection.sendFrame("a");
        connection.sendFrame("b");
        connection.send(new ServerPacket.Ready());
        runAll(tasks);

        assertThat(sink.frames()).containsExactly("a", "b", "{\"type\":\"ready\"}");
    }

    @Test
    void packetsOutsideCapabilitiesAreNotQueued() {
        final RecordingSink sink = new RecordingSink();
        final List<Runnable> tasks = new ArrayList<>();
        final Connection connection = connection(sink, tasks, 16);

        assertThat(connection.send(new ServerPacket.PixelsAvailable(1, null))).isFalse();
        runAll(tasks);

        assertThat(sink.frames()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Connection", messagePattern = ".*fell 2 frames behind.*")
    void slowClientIsDisconnected() {
        final RecordingSink sink = new RecordingSink();
        final List<Runnable> tasks = new ArrayList<>();
        final Connection connection = connection(sink, tasks, 2);

        assertThat(connection.sendFrame("1")).isTrue();
        assertThat(connection.sendFrame("2")).isTrue();
        assertThat(connection.sendFrame("3")).isFalse();

        assertThat(connection.state()).isEqualTo(Connection.State.CLOSED);
        assertThat(sink.closeCode()).isEqualTo(CloseReason.SERVER_ERROR.code());
        runAll(tasks);
        assertThat(sink.frames()).isEmpty();
    }

    @Test
    void failedSendMarksConnectionClosed() {
        final List<Runnable> tasks = new ArrayList<>();
        final Connection connection = connection(new ConnectionSink() {
            @Override
            public void send(final String frame) throws IOException {
                throw new IOException("broken pipe");
            }

            @Override
            public void close(final int code, final String reason) {
            }
        }, tasks, 16);

        connection.sendFrame("x");
        runAll(tasks);

        assertThat(connection.state()).isEqualTo(Connection.State.CLOSED);
        assertThat(connection.sendFrame("y")).isFalse();
    }

    @Test
    void closeIsSentOnce() {
        final RecordingSink sink = new RecordingSink();
        final Connection connection = connection(sink, new ArrayList<>(), 16);

        connection.close(CloseReason.AUTH_TIMEOUT);
        connection.close(CloseReason.SERVER_CLOSING);

        assertThat(sink.closeCode()).isEqualTo(4000);
        assertThat(connection.markSubscribed()).isFalse();
    }

    @Test
    @DisplayName("A disconnect in the middle of a broadcast delivers each frame whole or not at all")
    void disconnectDuringBroadcastDropsTheRestWhole() {
        final List<String> received = new ArrayList<>();
        final List<Runnable> tasks = new ArrayList<>();
        final AtomicReference<Connection> self = new AtomicReference<>();
        final Connection connection = connection(new ConnectionSink() {
            @Override
            public void send(final String frame) {
                received.add(frame);
                self.get().close(CloseReason.SERVER_CLOSING);
            }

            @Override
            public void close(final int code, final String reason) {
            }
        }, tasks, 16);
        self.set(connection);
        final String first = PacketCodec.encode(ServerPacket.BoardUpdate.ofData(new ServerPacket.BoardData(
            List.of(new Change(0, new long[]{1, 2, 3, 4})), null, null, null)));

        connection.sendFrame(first);
        connection.sendFrame("second");
        connection.sendFrame("third");
        runAll(tasks);

        assertThat(received).containsExactly(first);
        assertThat(connection.sendFrame("late")).isFalse();
        runAll(tasks);
        assertThat(received).containsExactly(first);
    }

    @Test
    void framesQueuedBeforeADisconnectAreNeverSent() {
        final RecordingSink sink = new RecordingSink();
        final List<Runnable> tasks = new ArrayList<>();
        final Connection connection = connection(sink, tasks, 16);

        connection.sendFrame("a");
        connection.sendFrame("b");
        connection.close(CloseReason.SERVER_CLOSING);
        runAll(tasks);

        assertThat(sink.frames()).isEmpty();
        assertThat(sink.closeCode()).isEqualTo(1001);
    }
}
