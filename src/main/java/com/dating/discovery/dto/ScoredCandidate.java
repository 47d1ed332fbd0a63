package com.dating.discovery.dto;

import com.dating.discovery.models.Profile;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.OptionalDouble;

/**
 * Eligible candidate with its ranking inputs. Natural order is the ranking order: higher score first,
 * then the more recently created profile, then the lower user id.
 */
public record ScoredCandidate(
        Profile profile,
        DiscoverySettings settings,
        int score,
        OptionalDouble distanceKm
) implements Comparable<ScoredCandidate> {

    private static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingInt(ScoredCandidate::score).reversed()
            .thenComparing(c -> c.profile().getCreatedAt(), Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(c -> c.profile().getUserId());

    @Override
    public int compareTo(ScoredCandidate o) {
        return RANKING.compare(this, o);
    }
}
