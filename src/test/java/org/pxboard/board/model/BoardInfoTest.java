package org.pxboard.board.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BoardInfoTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private static BoardInfo info() {
        return new BoardInfo(7, "canvas", CREATED, Shape.of(new int[]{4}),
            Map.of(0, new PaletteColor("white", 0xFFFFFFFFL)), 6, 6);
    }

    @Test
    void timestampsAreSecondsSinceCreationAndAtLeastOne() {
        final BoardInfo info = info();

        assertThat(info.timestampOf(CREATED)).isEqualTo(1);
        assertThat(info.timestampOf(CREATED.minusSeconds(50))).isEqualTo(1);
        assertThat(info.timestampOf(CREATED.plusSeconds(90).plusMillis(900))).isEqualTo(90);
        assertThat(info.instantOf(90)).isEqualTo(CREATED.plusSeconds(90));
    }

    @Test
    void serializesCreationTimeAsEpochSeconds() throws Exception {
        final String json = new ObjectMapper().writeValueAsString(info());

        assertThat(json).contains("\"createdAt\":" + CREATED.getEpochSecond());
        assertThat(json).contains("\"shape\":[[4]]");
        assertThat(json).contains("\"palette\":{\"0\":{\"name\":\"white\"");
    }

    @Test
    void rejectsNegativeLimits() {
        assertThatThrownBy(() -> info().withLimits(-1, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bufferKindsResolveByPathName() {
        assertThat(BufferKind.fromPathName("Timestamps")).contains(BufferKind.TIMESTAMPS);
        assertThat(BufferKind.fromPathName("pixels")).isEmpty();
        assertThat(BufferKind.TIMESTAMPS.width()).isEqualTo(4);
        assertThat(MaskValue.fromValue(7)).isEqualTo(MaskValue.NO_PLACE);
    }
}
