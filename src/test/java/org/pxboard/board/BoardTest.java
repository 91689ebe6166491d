package org.pxboard.board;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pxboard.access.Identity;
import org.pxboard.board.cooldown.CooldownInfo;
import org.pxboard.board.exceptions.ConflictException;
import org.pxboard.board.exceptions.InvalidColorException;
import org.pxboard.board.exceptions.OutOfBoundsException;
import org.pxboard.board.exceptions.RateLimitedException;
import org.pxboard.board.exceptions.UnplaceableException;
import org.pxboard.board.model.BoardInfo;
import org.pxboard.board.model.BufferKind;
import org.pxboard.board.model.Placement;
import org.pxboard.junit.extensions.logging.LogWatchExtension;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Placement, undo and cooldown behaviour of a live board backed by H2.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class BoardTest {

    private static final Identity ALICE = new Identity("alice");
    private static final Identity BOB = new Identity("bob");

    private RuntimeFixture fixture;
    private Board board;
    private Instant t;

    @BeforeEach
    void setUp() throws Exception {
        fixture = RuntimeFixture.start();
        board = fixture.createPlaceableBoard(2, 2);
        t = fixture.clock.instant();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private int color(final long position) throws Exception {
        return board.read(BufferKind.COLORS, position, position + 1)[0];
    }

    private int timestamp(final long position) throws Exception {
        final byte[] bytes = board.read(BufferKind.TIMESTAMPS, position * 4, position * 4 + 4);
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }

    @Test
    void placementWritesColorAndTimestamp() throws Exception {
        final PlacementResult result = board.place(ALICE, 5, 2);

        assertThat(color(5)).isEqualTo(2);
        assertThat(timestamp(5)).isEqualTo(3600);
        assertThat(result.placement().userId()).isEqualTo("alice");
        assertThat(result.placement().timestamp()).isEqualTo(3600);
        assertThat(board.lookup(5)).contains(result.placement());
    }

    @Test
    void placementSpendsAPixel() throws Exception {
        final CooldownInfo after = board.place(ALICE, 1, 1).cooldown();

        assertThat(after.pixelsAvailable()).isEqualTo(1);
        assertThat(after.nextAvailable()).contains(t.plusSeconds(60));
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(1);
        assertThat(board.cooldown(BOB).pixelsAvailable()).isEqualTo(2);
    }

    @Test
    @DisplayName("An empty stack rejects placements until the next pixel arrives")
    void emptyStackIsRateLimited() throws Exception {
        board.place(ALICE, 1, 1);
        board.place(ALICE, 2, 1);

        final RateLimitedException limited = catchThrowableOfType(() -> board.place(ALICE, 3, 1), RateLimitedException.class);
        assertThat(limited.getCooldown().pixelsAvailable()).isZero();
        assertThat(limited.getCooldown().nextAvailable()).contains(t.plusSeconds(30));
        assertThat(color(3)).isZero();

        fixture.clock.advance(Duration.ofSeconds(30));
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(1);
        board.place(ALICE, 3, 1);
        assertThat(color(3)).isEqualTo(1);
    }

    @Test
    void placementChecksRunBeforeTheCooldown() throws Exception {
        assertThatThrownBy(() -> board.place(ALICE, 64, 1)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> board.place(ALICE, 0, 9)).isInstanceOf(InvalidColorException.class);
        assertThatThrownBy(() -> board.place(ALICE, 0, 0)).isInstanceOf(ConflictException.class);
        board.place(ALICE, 0, 1);
        assertThatThrownBy(() -> board.place(ALICE, 0, 1)).isInstanceOf(ConflictException.class);

        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(1);
    }

    @Test
    void maskedPixelsAreNotPlaceable() throws Exception {
        final Board fresh = fixture.runtime.boards().create("fresh", RuntimeFixture.SHAPE, RuntimeFixture.PALETTE, 2, 2);

        assertThatThrownBy(() -> fresh.place(ALICE, 0, 1)).isInstanceOf(UnplaceableException.class);

        fresh.patch(BufferKind.MASK, 0, new byte[]{2});
        assertThatThrownBy(() -> fresh.place(ALICE, 0, 1)).isInstanceOf(UnplaceableException.class);

        fresh.patch(BufferKind.MASK, 0, new byte[]{1});
        fresh.place(ALICE, 0, 1);
    }

    @Test
    void undoRestoresInitialColorAndRefunds() throws Exception {
        board.patch(BufferKind.INITIAL, 6, new byte[]{3});
        board.place(ALICE, 6, 1);

        final PlacementResult undone = board.undo(ALICE, 6);

        assertThat(color(6)).isEqualTo(3);
        assertThat(timestamp(6)).isZero();
        assertThat(undone.cooldown().pixelsAvailable()).isEqualTo(2);
        assertThat(board.lookup(6)).isEmpty();
    }

    @Test
    void undoRestoresPreviousPlacement() throws Exception {
        final Placement bobs = board.place(BOB, 4, 3).placement();
        fixture.clock.advance(Duration.ofSeconds(1));
        board.place(ALICE, 4, 2);

        board.undo(ALICE, 4);

        assertThat(color(4)).isEqualTo(3);
        assertThat(timestamp(4)).isEqualTo(bobs.timestamp());
        assertThat(board.lookup(4)).contains(bobs);
    }

    @Test
    void onlyTheOwnerMayUndo() throws Exception {
        board.place(ALICE, 7, 1);

        assertThatThrownBy(() -> board.undo(BOB, 7)).isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> board.undo(ALICE, 8)).isInstanceOf(ConflictException.class);
        assertThat(color(7)).isEqualTo(1);
    }

    @Test
    void undoExpires() throws Exception {
        final Placement placement = board.place(ALICE, 7, 1).placement();
        assertThat(board.undoDeadline(placement)).isEqualTo(t.plusSeconds(10));

        fixture.clock.advance(Duration.ofSeconds(11));

        assertThatThrownBy(() -> board.undo(ALICE, 7)).isInstanceOf(ConflictException.class);
        assertThat(color(7)).isEqualTo(1);
    }

    @Test
    void activeUsersLeaveAfterIdleTimeout() throws Exception {
        board.place(ALICE, 1, 1);
        board.place(BOB, 2, 1);
        board.place(ALICE, 3, 1);

        assertThat(board.activeUsers()).isEqualTo(2);

        fixture.clock.advance(Duration.ofMinutes(6));
        assertThat(board.activeUsers()).isZero();
    }

    @Test
    void readsAreClampedToTheBuffer() throws Exception {
        assertThat(board.length(BufferKind.COLORS)).isEqualTo(64);
        assertThat(board.length(BufferKind.TIMESTAMPS)).isEqualTo(256);
        assertThat(board.read(BufferKind.COLORS, 60, 1000)).hasSize(4);
        assertThatThrownBy(() -> board.read(BufferKind.COLORS, 64, 70)).isInstanceOf(OutOfBoundsException.class);
    }

    @Test
    void onlyMaskAndInitialArePatchable() {
        assertThatThrownBy(() -> board.patch(BufferKind.COLORS, 0, new byte[]{1}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loweringStackSizeAppliesImmediately() throws Exception {
        final BoardInfo updated = board.updateInfo("renamed", null, null, 1);

        assertThat(updated.name()).isEqualTo("renamed");
        assertThat(updated.maxStacked()).isEqualTo(1);
        assertThat(updated.palette()).isEqualTo(RuntimeFixture.PALETTE);
        assertThat(board.info()).isEqualTo(updated);
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(1);
    }

    @Test
    void bothLimitsChangeTogether() throws Exception {
        final BoardInfo updated = board.updateInfo(null, null, 5, 4);

        assertThat(updated.maxPixelsAvailable()).isEqualTo(5);
        assertThat(updated.maxStacked()).isEqualTo(4);
        assertThat(updated.name()).isEqualTo("test");
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(4);

        final BoardInfo reduced = board.updateInfo(null, null, 1, null);
        assertThat(reduced.maxStacked()).isEqualTo(4);
        assertThat(board.cooldown(ALICE).pixelsAvailable()).isEqualTo(1);
    }
}
