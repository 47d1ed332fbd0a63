package com.dating.discovery.directory;

import com.dating.discovery.dto.CandidatePage;
import com.dating.discovery.dto.CandidateQuery;
import com.dating.discovery.exceptions.NotFoundException;
import com.dating.discovery.models.Profile;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to profiles owned by the profile-management service.
 */
public interface ProfileDirectory {

    Optional<Profile> findProfile(long userId);

    default Profile getProfile(long userId) {
        return findProfile(userId).orElseThrow(() -> new NotFoundException("Profile not found for user " + userId));
    }

    /**
     * One page of the coarse candidate pool, newest profiles first. Implementations may apply any subset
     * of the query predicates; callers re-check every predicate on the returned profiles and follow
     * {@link CandidatePage#next()} while {@link CandidatePage#hasMore()} holds.
     */
    CandidatePage queryCandidates(CandidateQuery query);

    Map<Long, Profile> getProfiles(Collection<Long> userIds);
}
