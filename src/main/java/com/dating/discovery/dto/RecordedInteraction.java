package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.InteractionType;

/**
 * @param requested type the caller asked for
 * @param stored    type held by the row after the write; differs from {@code requested} when the pair
 *                  was already terminal
 */
public record RecordedInteraction(long actorId, long targetId, InteractionType requested, InteractionType stored) {

    public boolean suppressed() {
        return requested != stored;
    }
}
