package org.pxboard.board.socket;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Packets a socket client may send.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientPacket.Authenticate.class, name = "authenticate")
})
public interface ClientPacket {

    /**
     * Presents a bearer token. Required as first packet when the {@code authentication}
     * capability was negotiated; later occurrences refresh the credentials.
     */
    record Authenticate(String token) implements ClientPacket {
    }
}
