package org.pxboard.board;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pxboard.access.Identity;
import org.pxboard.board.exceptions.BoardNotFoundException;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.sector.SectorKey;
import org.pxboard.board.socket.RecordingSink;
import org.pxboard.junit.extensions.logging.LogWatchExtension;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class BoardRuntimeTest {

    @Test
    void boardsSurviveARestart() throws Exception {
        final RuntimeFixture first = RuntimeFixture.start();
        final int boardId;
        try {
            final Board board = first.createPlaceableBoard(2, 2);
            boardId = board.id();
            board.updateInfo("persisted", null, null, null);
            board.place(new Identity("alice"), 5, 2);
        } finally {
            first.close();
        }

        try (RuntimeFixture second = RuntimeFixture.restart(first)) {
            final Board board = second.runtime.boards().get(boardId);

            assertThat(board.info().name()).isEqualTo("persisted");
            assertThat(board.read(BufferKind.COLORS, 5, 6)).containsExactly(2);
            assertThat(board.read(BufferKind.MASK, 0, 1)).containsExactly(1);
            assertThat(board.lookup(5)).hasValueSatisfying(p -> assertThat(p.userId()).isEqualTo("alice"));
            assertThat(board.cooldown(new Identity("alice")).pixelsAvailable()).isEqualTo(1);
            assertThat(board.activeUsers()).isEqualTo(1);
        }
    }

    @Test
    void closingDisconnectsSockets() throws Exception {
        final RecordingSink sink = new RecordingSink();
        try (RuntimeFixture fixture = RuntimeFixture.start()) {
            final Board board = fixture.createPlaceableBoard(1, 1);
            fixture.runtime.sockets().onConnect(board.id(), List.of(), sink).orElseThrow();
            await().atMost(5, TimeUnit.SECONDS).until(() -> !sink.framesOfType("ready").isEmpty());

            fixture.close();

            assertThat(fixture.runtime.isRunning()).isFalse();
            assertThat(fixture.runtime.connections().size()).isZero();
        }
        assertThat(sink.closeCode()).isEqualTo(1001);
    }

    @Test
    void deletedBoardDisconnectsItsSocketsAndStaysGone() throws Exception {
        final RecordingSink doomedSink = new RecordingSink();
        final RecordingSink keptSink = new RecordingSink();
        final RuntimeFixture first = RuntimeFixture.start();
        final int doomedId;
        final int keptId;
        try {
            final Board doomed = first.createPlaceableBoard(1, 1);
            final Board kept = first.createPlaceableBoard(1, 1);
            doomedId = doomed.id();
            keptId = kept.id();
            doomed.place(new Identity("alice"), 5, 2);
            first.runtime.sockets().onConnect(doomedId, List.of(), doomedSink).orElseThrow();
            first.runtime.sockets().onConnect(keptId, List.of(), keptSink).orElseThrow();
            await().atMost(5, TimeUnit.SECONDS).until(() -> !doomedSink.framesOfType("ready").isEmpty()
                && !keptSink.framesOfType("ready").isEmpty());
            assertThat(first.runtime.sectors().isResident(new SectorKey(doomedId, BufferKind.MASK, 0))).isTrue();

            first.runtime.boards().delete(doomedId);

            assertThat(doomedSink.closeCode()).isEqualTo(1001);
            assertThat(keptSink.isClosed()).isFalse();
            assertThat(first.runtime.connections().size()).isEqualTo(1);
            assertThat(first.runtime.sectors().isResident(new SectorKey(doomedId, BufferKind.MASK, 0))).isFalse();
            assertThat(first.runtime.boards().first().id()).isEqualTo(keptId);
            assertThatThrownBy(() -> first.runtime.boards().get(doomedId)).isInstanceOf(BoardNotFoundException.class);
            assertThatThrownBy(() -> first.runtime.boards().delete(doomedId)).isInstanceOf(BoardNotFoundException.class);
        } finally {
            first.close();
        }

        try (RuntimeFixture second = RuntimeFixture.restart(first)) {
            assertThat(second.runtime.boards().list()).extracting(Board::id).containsExactly(keptId);
        }
    }
}
