package org.pxboard.board.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.pxboard.board.exceptions.MalformedHandshakeException;

import java.util.Optional;
import java.util.Set;

/**
 * JSON encoding of socket packets.
 * <p>
 * Server packets are filtered by the receiving connection's capabilities while encoding:
 * fields a client did not negotiate are left out, and a packet with nothing left is not sent.
 */
public final class PacketCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private PacketCodec() {
        // Utility class
    }

    /**
     * Encodes a packet for receivers with the given capabilities.
     *
     * @return The frame, or empty if the receivers should not get this packet.
     */
    public static Optional<String> encodeFor(final ServerPacket packet, final Set<Capability> capabilities) {
        return filter(packet, capabilities).map(PacketCodec::encode);
    }

    /**
     * Encodes a packet as is.
     */
    public static String encode(final ServerPacket packet) {
        try {
            return MAPPER.writeValueAsString(packet);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + packet.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses a client packet.
     *
     * @throws MalformedHandshakeException if the text is not a known packet.
     */
    public static ClientPacket decode(final String text) throws MalformedHandshakeException {
        try {
            final ClientPacket packet = MAPPER.readValue(text, ClientPacket.class);
            if (packet == null) {
                throw new MalformedHandshakeException("Empty packet");
            }
            return packet;
        } catch (final JsonProcessingException e) {
            throw new MalformedHandshakeException("Malformed packet: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Strips the parts of a packet the capabilities do not cover.
     */
    public static Optional<ServerPacket> filter(final ServerPacket packet, final Set<Capability> capabilities) {
        if (packet instanceof ServerPacket.BoardUpdate) {
            final ServerPacket.BoardUpdate update = (ServerPacket.BoardUpdate) packet;
            final boolean core = capabilities.contains(Capability.CORE);
            final ServerPacket.BoardData data = update.data();
            final ServerPacket.BoardData filteredData = data == null ? null : new ServerPacket.BoardData(
                core ? data.colors() : null,
                capabilities.contains(Capability.BOARD_TIMESTAMPS) ? data.timestamps() : null,
                capabilities.contains(Capability.BOARD_INITIAL) ? data.initial() : null,
                capabilities.contains(Capability.BOARD_MASK) ? data.mask() : null);
            final ServerPacket.BoardUpdate filtered = new ServerPacket.BoardUpdate(
                core ? update.info() : null,
                filteredData == null || filteredData.isEmpty() ? null : filteredData);
            return filtered.isEmpty() ? Optional.empty() : Optional.of(filtered);
        }
        if (packet instanceof ServerPacket.PixelsAvailable) {
            return capabilities.contains(Capability.AUTHENTICATION) ? Optional.of(packet) : Optional.empty();
        }
        return Optional.of(packet);
    }
}
