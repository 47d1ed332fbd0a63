package com.dating.discovery.processors;

import com.dating.discovery.dto.MatchCreation;
import com.dating.discovery.models.Match;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Match rows keyed by the canonical pair {@code userLowId < userHighId}.
 */
public interface MatchStore {

    /**
     * Creates the row when absent and returns the existing one otherwise. {@link MatchCreation#created()}
     * is true only for the caller whose insert produced the row.
     *
     * @throws IllegalArgumentException when {@code userLowId >= userHighId}
     * @throws org.springframework.dao.TransientDataAccessException when the winning row is not visible yet
     */
    MatchCreation insertIfAbsent(long userLowId, long userHighId, LocalDateTime at);

    Optional<Match> find(long userLowId, long userHighId);

    /** Matches involving {@code userId}, newest first. */
    List<Match> findByUser(long userId, int offset, int limit);
}
