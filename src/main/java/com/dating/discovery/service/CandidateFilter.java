package com.dating.discovery.service;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.directory.ModerationSignal;
import com.dating.discovery.directory.ProfileDirectory;
import com.dating.discovery.dto.CandidateCursor;
import com.dating.discovery.dto.CandidatePage;
import com.dating.discovery.dto.CandidateQuery;
import com.dating.discovery.dto.DiscoverySettings;
import com.dating.discovery.dto.ScoredCandidate;
import com.dating.discovery.models.Profile;
import com.dating.discovery.processors.InteractionStore;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Selects and ranks eligible candidates for a viewer.
 * <p>
 * The directory pool is only a coarse pre-filter, read in keyset pages that may be served from a
 * short-lived cache. Every eligibility rule is re-checked here against fresh interaction and
 * moderation state:
 * <ol>
 *   <li>the viewer and anyone the viewer already interacted with are excluded,</li>
 *   <li>anyone holding a block or report against the viewer is excluded,</li>
 *   <li>restricted (banned or hidden) profiles are excluded,</li>
 *   <li>both gender preferences must admit the other side,</li>
 *   <li>the candidate's age and raw distance must fall within the viewer's settings.</li>
 * </ol>
 * </p>
 */
@Slf4j
@Component
public class CandidateFilter {
    private final ProfileDirectory profileDirectory;
    private final InteractionStore interactionStore;
    private final ModerationSignal moderationSignal;
    private final PreferenceResolver preferenceResolver;
    private final DistanceCalculator distanceCalculator;
    private final CompatibilityScorer compatibilityScorer;
    private final Cache<CandidateQuery, CandidatePage> candidatePoolCache;
    private final DiscoveryProperties.Candidates candidateProperties;
    private final Clock clock;

    public CandidateFilter(ProfileDirectory profileDirectory,
                           InteractionStore interactionStore,
                           ModerationSignal moderationSignal,
                           PreferenceResolver preferenceResolver,
                           DistanceCalculator distanceCalculator,
                           CompatibilityScorer compatibilityScorer,
                           @Qualifier("candidatePoolCache") Cache<CandidateQuery, CandidatePage> candidatePoolCache,
                           DiscoveryProperties properties,
                           Clock clock) {
        this.profileDirectory = profileDirectory;
        this.interactionStore = interactionStore;
        this.moderationSignal = moderationSignal;
        this.preferenceResolver = preferenceResolver;
        this.distanceCalculator = distanceCalculator;
        this.compatibilityScorer = compatibilityScorer;
        this.candidatePoolCache = candidatePoolCache;
        this.candidateProperties = properties.getCandidates();
        this.clock = clock;
    }

    /**
     * Scans the directory page by page and keeps the best {@code pageSize} candidates seen, so ranking is
     * over every eligible profile rather than the first page of the pool. The scan stops when the
     * directory runs dry or after {@code maxScannedProfiles} rows.
     *
     * @return up to {@code pageSize} candidates in ranking order
     */
    public List<ScoredCandidate> findEligible(Profile viewer, DiscoverySettings viewerSettings, int pageSize) {
        LocalDate today = LocalDate.now(clock);
        Set<Long> excluded = exclusionsFor(viewer.getUserId());
        // head is the weakest of the kept candidates
        PriorityQueue<ScoredCandidate> best = new PriorityQueue<>(pageSize + 1, Comparator.reverseOrder());

        CandidateCursor cursor = null;
        int scanned = 0;
        int pages = 0;
        boolean hasMore = true;
        while (hasMore) {
            CandidateQuery query = buildQuery(viewer, viewerSettings, pageSize, today, cursor);
            CandidatePage page = candidatePoolCache.get(query, profileDirectory::queryCandidates);
            pages++;
            scanned += page.profiles().size();

            for (ScoredCandidate candidate : score(viewer, viewerSettings, page.profiles(), excluded, today)) {
                best.offer(candidate);
                if (best.size() > pageSize) {
                    best.poll();
                }
            }

            hasMore = page.hasMore() && page.next() != null;
            cursor = page.next();
            if (hasMore && scanned >= candidateProperties.getMaxScannedProfiles()) {
                log.warn("Candidate scan for viewer={} stopped after {} profiles", viewer.getUserId(), scanned);
                break;
            }
        }

        List<ScoredCandidate> ranked = new ArrayList<>(best);
        Collections.sort(ranked);
        log.debug("viewer={} pages={} scanned={} returned={}", viewer.getUserId(), pages, scanned, ranked.size());
        return ranked;
    }

    private List<ScoredCandidate> score(Profile viewer, DiscoverySettings viewerSettings, List<Profile> pool,
                                        Set<Long> excluded, LocalDate today) {
        List<Profile> remaining = pool.stream()
                .filter(candidate -> !excluded.contains(candidate.getUserId()))
                .filter(candidate -> !moderationSignal.isRestricted(candidate))
                .toList();
        if (remaining.isEmpty()) {
            return List.of();
        }
        Map<Long, DiscoverySettings> candidateSettings = preferenceResolver.resolveAll(remaining);

        List<ScoredCandidate> eligible = new ArrayList<>();
        for (Profile candidate : remaining) {
            DiscoverySettings settings = candidateSettings.get(candidate.getUserId());
            if (!mutuallyAdmits(viewer, viewerSettings, candidate, settings)) {
                log.debug("viewer={} candidate={} rejected: orientation", viewer.getUserId(), candidate.getUserId());
                continue;
            }
            if (!viewerSettings.admitsAge(candidate.ageOn(today))) {
                log.debug("viewer={} candidate={} rejected: age", viewer.getUserId(), candidate.getUserId());
                continue;
            }
            OptionalDouble distance = distanceCalculator.distanceKm(viewer, candidate);
            if (!distanceCalculator.withinRange(distance, viewerSettings.maxDistanceKm())) {
                log.debug("viewer={} candidate={} rejected: distance", viewer.getUserId(), candidate.getUserId());
                continue;
            }
            int score = compatibilityScorer.score(viewer, candidate, today);
            eligible.add(new ScoredCandidate(candidate, settings, score, distance));
        }
        return eligible;
    }

    /**
     * Both directions of the gender preference must hold; a candidate who could never reciprocate is
     * never surfaced.
     */
    public static boolean mutuallyAdmits(Profile viewer, DiscoverySettings viewerSettings,
                                         Profile candidate, DiscoverySettings candidateSettings) {
        return viewerSettings.preferredGender().admits(candidate.getGender())
                && candidateSettings.preferredGender().admits(viewer.getGender());
    }

    Set<Long> exclusionsFor(long viewerId) {
        Set<Long> excluded = new HashSet<>(interactionStore.findTargetIds(viewerId));
        excluded.addAll(interactionStore.findTerminalActorIds(viewerId));
        excluded.add(viewerId);
        return excluded;
    }

    CandidateQuery buildQuery(Profile viewer, DiscoverySettings settings, int pageSize, LocalDate today,
                              CandidateCursor after) {
        return CandidateQuery.builder()
                .viewerId(viewer.getUserId())
                .viewerGender(viewer.getGender())
                .genders(settings.preferredGender().admittedGenders())
                .bornOnOrAfter(today.minusYears(settings.maxAge() + 1L).plusDays(1))
                .bornOnOrBefore(today.minusYears(settings.minAge()))
                .after(after)
                .limit(candidateProperties.poolSizeFor(pageSize))
                .build();
    }
}
