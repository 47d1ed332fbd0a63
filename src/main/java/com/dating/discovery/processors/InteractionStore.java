package com.dating.discovery.processors;

import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.models.Interaction;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Directional interaction rows, unique per ordered {@code (actor, target)} pair.
 */
public interface InteractionStore {

    /**
     * Inserts or overwrites the row for the pair as a single statement. A stored BLOCK or REPORT is
     * kept unless the new type escalates BLOCK to REPORT.
     *
     * @return the type held by the row after the call
     */
    InteractionType upsert(long actorId, long targetId, InteractionType type, LocalDateTime at);

    Optional<Interaction> find(long actorId, long targetId);

    /** Every user the actor has interacted with, whatever the type. */
    Set<Long> findTargetIds(long actorId);

    /** Users holding a BLOCK or REPORT against {@code targetId}. */
    Set<Long> findTerminalActorIds(long targetId);

    /**
     * Likes and superlikes received by {@code targetId} that it has not answered with any
     * interaction; superlikes first, then most recent.
     */
    List<Interaction> findUnansweredPositive(long targetId, int limit);
}
