package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.Gender;
import lombok.Builder;

import java.time.LocalDate;
import java.util.Set;

/**
 * One page of the coarse filter pushed down to the profile directory. Implementations may ignore any
 * predicate; the candidate filter re-checks every one of them on the returned rows. {@code after} is
 * null for the first page.
 */
@Builder
public record CandidateQuery(
        long viewerId,
        Gender viewerGender,
        Set<Gender> genders,
        LocalDate bornOnOrAfter,
        LocalDate bornOnOrBefore,
        CandidateCursor after,
        int limit
) {
}
