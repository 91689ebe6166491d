package org.pxboard.board.cooldown;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CooldownCalculatorTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private final CooldownCalculator calculator = new CooldownCalculator(new CooldownCurve(Duration.ofSeconds(30)));

    @Test
    void emptyHistoryMeansFullStack() {
        final CooldownInfo info = calculator.compute(List.of(), 3, T);

        assertThat(info.pixelsAvailable()).isEqualTo(3);
        assertThat(info.nextAvailable()).isEmpty();
    }

    @Test
    void singlePlacementSpendsOnePixel() {
        final CooldownInfo info = calculator.compute(List.of(T), 3, T);

        assertThat(info.pixelsAvailable()).isEqualTo(2);
        assertThat(info.nextAvailable()).contains(T.plusSeconds(90));
    }

    @Test
    @DisplayName("Each stack slot refills at its own depth, not counted from the last placement")
    void deeperSlotsRefillLater() {
        assertThat(calculator.schedule(List.of(T), 3))
            .containsExactly(T, T, T.plusSeconds(90));
        assertThat(calculator.schedule(List.of(T, T), 3))
            .containsExactly(T, T.plusSeconds(60), T.plusSeconds(90));
    }

    @Test
    @DisplayName("Placing the whole stack at once empties it and pixels return one step apart")
    void burstEmptiesStack() {
        final List<Instant> history = List.of(T, T, T);

        assertThat(calculator.schedule(history, 3))
            .containsExactly(T.plusSeconds(30), T.plusSeconds(60), T.plusSeconds(90));
        assertThat(calculator.compute(history, 3, T).pixelsAvailable()).isZero();
        assertThat(calculator.compute(history, 3, T.plusSeconds(65)).pixelsAvailable()).isEqualTo(2);
    }

    @Test
    void regainedPixelsCountBeforeNextPlacement() {
        // Two placements at T leave one pixel, spent at T+40 before the T+60 refill.
        final List<Instant> history = List.of(T, T, T.plusSeconds(40));

        final CooldownInfo info = calculator.compute(history, 3, T.plusSeconds(40));

        assertThat(info.pixelsAvailable()).isZero();
        assertThat(info.nextAvailable()).contains(T.plusSeconds(70));
        assertThat(calculator.compute(List.of(T, T, T.plusSeconds(70)), 3, T.plusSeconds(70)).pixelsAvailable())
            .isEqualTo(1);
    }

    @Test
    void onlyRecentHistoryMatters() {
        final List<Instant> longAgo = List.of(T.minusSeconds(10_000), T.minusSeconds(9_000), T);

        assertThat(calculator.schedule(longAgo, 2)).isEqualTo(calculator.schedule(List.of(T.minusSeconds(9_000), T), 2));
    }

    @Test
    void zeroLimitMeansNothingAvailable() {
        final CooldownInfo info = calculator.compute(List.of(), 0, T);

        assertThat(info.pixelsAvailable()).isZero();
        assertThat(info.nextAvailable()).isEmpty();
    }
}
