package org.pxboard.board.socket;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pxboard.board.model.BufferKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class BoardUpdateBuilderTest {

    private static Change change(final long position, final long... values) {
        return new Change(position, values);
    }

    @Test
    @DisplayName("Later changes overwrite earlier ones and touching runs are joined")
    void laterChangesWinAndRunsJoin() {
        final List<Change> minified = BoardUpdateBuilder.minify(List.of(
            change(0, 1, 1, 1, 1),
            change(2, 5)));

        assertThat(minified).containsExactly(change(0, 1, 1, 5, 1));
    }

    @Test
    void disjointChangesAreSortedByPosition() {
        final List<Change> minified = BoardUpdateBuilder.minify(List.of(
            change(10, 3),
            change(2, 4, 4),
            change(7)));

        assertThat(minified).containsExactly(change(2, 4, 4), change(10, 3));
    }

    @Test
    void changeCoveringEarlierRunsReplacesThem() {
        final List<Change> minified = BoardUpdateBuilder.minify(List.of(
            change(3, 1),
            change(5, 1),
            change(2, 9, 9, 9, 9, 9)));

        assertThat(minified).containsExactly(change(2, 9, 9, 9, 9, 9));
    }

    @Test
    void mergesUpdatesPerBuffer() {
        final ServerPacket.BoardUpdate update = new BoardUpdateBuilder()
            .merge(ServerPacket.BoardUpdate.ofData(new ServerPacket.BoardData(
                List.of(change(1, 2)), List.of(change(1, 100)), null, null)))
            .merge(ServerPacket.BoardUpdate.ofData(new ServerPacket.BoardData(
                List.of(change(2, 3)), List.of(change(2, 101)), null, null)))
            .change(BufferKind.MASK, change(0, 1))
            .build();

        assertThat(update.info()).isNull();
        assertThat(update.data().colors()).containsExactly(change(1, 2, 3));
        assertThat(update.data().timestamps()).containsExactly(change(1, 100, 101));
        assertThat(update.data().mask()).containsExactly(change(0, 1));
        assertThat(update.data().initial()).isNull();
    }

    @Test
    void emptyBuilderBuildsEmptyUpdate() {
        final BoardUpdateBuilder builder = new BoardUpdateBuilder();

        assertThat(builder.isEmpty()).isTrue();
        assertThat(builder.build().isEmpty()).isTrue();
    }
}
