package org.pxboard.board.socket;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.pxboard.board.model.BoardInfo;

import java.util.List;

/**
 * Packets sent to socket clients. Absent optional fields are omitted from the wire format.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerPacket.BoardUpdate.class, name = "board-update"),
    @JsonSubTypes.Type(value = ServerPacket.PixelsAvailable.class, name = "pixels-available"),
    @JsonSubTypes.Type(value = ServerPacket.Ready.class, name = "ready")
})
public interface ServerPacket {

    /**
     * A change to board metadata and/or buffer contents.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record BoardUpdate(BoardInfo info, BoardData data) implements ServerPacket {

        public static BoardUpdate ofInfo(final BoardInfo info) {
            return new BoardUpdate(info, null);
        }

        public static BoardUpdate ofData(final BoardData data) {
            return new BoardUpdate(null, data);
        }

        @JsonIgnore
        public boolean isEmpty() {
            return info == null && (data == null || data.isEmpty());
        }
    }

    /**
     * Changed ranges per buffer; a buffer without changes is {@code null}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record BoardData(List<Change> colors, List<Change> timestamps, List<Change> initial, List<Change> mask) {

        @JsonIgnore
        public boolean isEmpty() {
            return colors == null && timestamps == null && initial == null && mask == null;
        }
    }

    /**
     * Pixels the receiving user may currently place.
     *
     * @param count Available pixels.
     * @param next  Epoch second at which the next pixel arrives, or {@code null} if the stack is full.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PixelsAvailable(int count, Long next) implements ServerPacket {
    }

    /**
     * Sent once the connection is admitted and subscribed.
     */
    record Ready() implements ServerPacket {
    }
}
