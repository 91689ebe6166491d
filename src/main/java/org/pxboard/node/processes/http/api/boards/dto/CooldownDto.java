package org.pxboard.node.processes.http.api.boards.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.pxboard.board.cooldown.CooldownInfo;

/**
 * A user's pixel availability.
 *
 * @param pixelsAvailable Pixels the user may place now.
 * @param nextAvailable   Epoch second at which the next pixel becomes available, absent when the stack is full.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CooldownDto(int pixelsAvailable, Long nextAvailable) {

    public static CooldownDto from(final CooldownInfo info) {
        return new CooldownDto(info.pixelsAvailable(), info.nextAvailable().map(i -> i.getEpochSecond()).orElse(null));
    }
}
