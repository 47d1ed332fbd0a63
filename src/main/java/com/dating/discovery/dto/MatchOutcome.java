package com.dating.discovery.dto;

import com.dating.discovery.models.Match;

/**
 * Result of a reciprocity check. {@code created} is true only for the call whose insert produced the
 * match row; concurrent callers that found it already present get {@code matched=true, created=false}.
 */
public record MatchOutcome(boolean matched, Match match, boolean created) {

    private static final MatchOutcome NO_MATCH = new MatchOutcome(false, null, false);

    public static MatchOutcome noMatch() {
        return NO_MATCH;
    }

    public static MatchOutcome newlyMatched(Match match) {
        return new MatchOutcome(true, match, true);
    }

    public static MatchOutcome alreadyMatched(Match match) {
        return new MatchOutcome(true, match, false);
    }
}
