package org.pxboard.board.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata of a board.
 *
 * @param id                 Board identifier.
 * @param name               Display name.
 * @param createdAt          Creation time; placement timestamps are relative to it.
 * @param shape              Geometry.
 * @param palette            Palette index to color.
 * @param maxPixelsAvailable Upper bound on the pixels a user is told they may place.
 * @param maxStacked         Number of pixels a user can accumulate while idle.
 */
public record BoardInfo(int id, String name,
                        @JsonSerialize(using = BoardInfo.EpochSecondSerializer.class) Instant createdAt, Shape shape,
                        Map<Integer, PaletteColor> palette, int maxPixelsAvailable, int maxStacked) {

    public BoardInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(shape, "shape");
        palette = Map.copyOf(palette);
        if (maxPixelsAvailable < 0 || maxStacked < 0) {
            throw new IllegalArgumentException("Pixel limits must not be negative");
        }
    }

    public boolean hasColor(final int color) {
        return palette.containsKey(color);
    }

    /**
     * Converts an instant to the board-relative timestamp stored with placements, at least 1.
     */
    public int timestampOf(final Instant instant) {
        final long seconds = instant.getEpochSecond() - createdAt.getEpochSecond();
        return (int) Math.max(1, Math.min(seconds, Integer.MAX_VALUE));
    }

    /**
     * Converts a board-relative timestamp back to an instant.
     */
    public Instant instantOf(final long timestamp) {
        return createdAt.plusSeconds(timestamp);
    }

    public BoardInfo withName(final String newName) {
        return new BoardInfo(id, newName, createdAt, shape, palette, maxPixelsAvailable, maxStacked);
    }

    public BoardInfo withPalette(final Map<Integer, PaletteColor> newPalette) {
        return new BoardInfo(id, name, createdAt, shape, newPalette, maxPixelsAvailable, maxStacked);
    }

    public BoardInfo withLimits(final int newMaxPixelsAvailable, final int newMaxStacked) {
        return new BoardInfo(id, name, createdAt, shape, palette, newMaxPixelsAvailable, newMaxStacked);
    }

    /**
     * Writes an instant as epoch seconds, the form used on the wire.
     */
    public static final class EpochSecondSerializer extends StdSerializer<Instant> {

        public EpochSecondSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(final Instant value, final JsonGenerator gen, final SerializerProvider provider)
            throws IOException {
            gen.writeNumber(value.getEpochSecond());
        }
    }
}
