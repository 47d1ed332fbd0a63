package com.dating.discovery.directory;

import com.dating.discovery.dto.CandidateCursor;
import com.dating.discovery.dto.CandidatePage;
import com.dating.discovery.dto.CandidateQuery;
import com.dating.discovery.dto.enums.GenderPreference;
import com.dating.discovery.models.Profile;
import com.dating.discovery.repo.CandidateCursorProjection;
import com.dating.discovery.repo.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaProfileDirectory implements ProfileDirectory {
    private final ProfileRepository profileRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Profile> findProfile(long userId) {
        return profileRepository.findWithInterestsByUserId(userId);
    }

    /*
     * Ids and keyset columns first, then a single fetch-join hydration keeping the order of the id query.
     * The cursor comes from the id rows so a profile deleted between the two reads cannot stall the scan.
     */
    @Override
    @Transactional(readOnly = true)
    public CandidatePage queryCandidates(CandidateQuery query) {
        if (query.genders() == null || query.genders().isEmpty() || query.limit() <= 0) {
            return CandidatePage.empty();
        }
        List<String> genders = query.genders().stream().map(Enum::name).toList();
        String viewerGender = query.viewerGender() == null ? GenderPreference.ANY.name() : query.viewerGender().name();
        CandidateCursor after = query.after();
        List<CandidateCursorProjection> rows = profileRepository.findCandidatePage(query.viewerId(), viewerGender,
                genders, query.bornOnOrAfter(), query.bornOnOrBefore(),
                after == null ? null : after.createdAt(),
                after == null ? null : after.userId(),
                query.limit());
        if (rows.isEmpty()) {
            return CandidatePage.empty();
        }

        List<Long> ids = rows.stream().map(CandidateCursorProjection::getUserId).toList();
        Map<Long, Profile> byId = getProfiles(ids);
        List<Profile> ordered = new ArrayList<>(ids.size());
        for (Long id : ids) {
            Profile profile = byId.get(id);
            if (profile != null) {
                ordered.add(profile);
            }
        }

        CandidateCursorProjection last = rows.get(rows.size() - 1);
        boolean hasMore = rows.size() == query.limit();
        log.debug("Candidate page for viewer={}: {} ids, {} hydrated, hasMore={}",
                query.viewerId(), ids.size(), ordered.size(), hasMore);
        return new CandidatePage(ordered, hasMore, new CandidateCursor(last.getCreatedAt(), last.getUserId()));
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, Profile> getProfiles(Collection<Long> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        return profileRepository.findAllWithInterestsByUserIdIn(userIds).stream()
                .collect(Collectors.toMap(Profile::getUserId, Function.identity(), (a, b) -> a));
    }
}
