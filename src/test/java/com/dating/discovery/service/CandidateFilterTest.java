package com.dating.discovery.service;

import com.dating.discovery.config.CacheConfig;
import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.directory.ProfileModerationSignal;
import com.dating.discovery.dto.CandidateCursor;
import com.dating.discovery.dto.CandidateQuery;
import com.dating.discovery.dto.DiscoverySettings;
import com.dating.discovery.dto.ScoredCandidate;
import com.dating.discovery.dto.enums.Gender;
import com.dating.discovery.dto.enums.GenderPreference;
import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.models.DiscoverySettingsEntity;
import com.dating.discovery.models.Profile;
import com.dating.discovery.support.InMemoryInteractionStore;
import com.dating.discovery.support.InMemoryProfileDirectory;
import com.dating.discovery.support.MutableClock;
import com.dating.discovery.support.SettingsRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.dating.discovery.support.TestProfiles.*;
import static org.assertj.core.api.Assertions.assertThat;

class CandidateFilterTest {
    private static final String PARIS = "u09tv";

    private InMemoryProfileDirectory directory;
    private InMemoryInteractionStore interactions;
    private Map<Long, DiscoverySettingsEntity> storedSettings;
    private DiscoveryProperties properties;
    private PreferenceResolver resolver;
    private CandidateFilter filter;

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        MutableClock clock = new MutableClock(NOW);
        directory = new InMemoryProfileDirectory();
        interactions = new InMemoryInteractionStore();
        storedSettings = new HashMap<>();
        resolver = new PreferenceResolverImpl(directory, SettingsRepositories.backedBy(storedSettings), properties, clock);
        filter = new CandidateFilter(directory, interactions, new ProfileModerationSignal(), resolver,
                new DistanceCalculator(), new WeightedCompatibilityScorer(properties),
                new CacheConfig().candidatePoolCache(properties), properties, clock);
    }

    private List<Long> idsFor(Profile viewer) {
        return filter.findEligible(viewer, resolver.resolve(viewer), 50).stream()
                .map(c -> c.profile().getUserId())
                .toList();
    }

    @Test
    @DisplayName("Only candidates whose own preference admits the viewer are surfaced")
    void mutualOrientation_BothDirectionsRequired() {
        Profile viewer = profile(1, Gender.FEMALE).orientation(GenderPreference.MALE).build();
        Profile straightMan = profile(2, Gender.MALE).orientation(GenderPreference.FEMALE).build();
        Profile gayMan = profile(3, Gender.MALE).orientation(GenderPreference.MALE).build();
        Profile openMan = profile(4, Gender.MALE).orientation(GenderPreference.ANY).build();
        Profile woman = profile(5, Gender.FEMALE).orientation(GenderPreference.ANY).build();
        directory.add(viewer, straightMan, gayMan, openMan, woman);

        assertThat(idsFor(viewer)).containsExactlyInAnyOrder(2L, 4L);
    }

    @Test
    @DisplayName("A stored preferred gender overrides the profile orientation")
    void mutualOrientation_SettingsOverrideOrientation() {
        Profile viewer = profile(1, Gender.FEMALE).orientation(GenderPreference.MALE).build();
        Profile man = profile(2, Gender.MALE).orientation(GenderPreference.FEMALE).build();
        directory.add(viewer, man);
        storedSettings.put(2L, DiscoverySettingsEntity.builder().userId(2L).preferredGender(GenderPreference.OTHER).build());

        assertThat(idsFor(viewer)).isEmpty();
    }

    @Test
    @DisplayName("If A is shown to B then B is shown to A, for every gender and preference combination")
    void mutualOrientation_IsSymmetric() {
        long nextId = 1;
        for (Gender ga : Gender.values()) {
            for (GenderPreference pa : GenderPreference.values()) {
                for (Gender gb : Gender.values()) {
                    for (GenderPreference pb : GenderPreference.values()) {
                        setUp();
                        Profile a = profile(nextId++, ga).orientation(pa).build();
                        Profile b = profile(nextId++, gb).orientation(pb).build();
                        directory.add(a, b);

                        boolean aSeesB = idsFor(a).contains(b.getUserId());
                        boolean bSeesA = idsFor(b).contains(a.getUserId());

                        assertThat(aSeesB).as("%s/%s vs %s/%s", ga, pa, gb, pb).isEqualTo(bSeesA);
                        assertThat(aSeesB).isEqualTo(pa.admits(gb) && pb.admits(ga));
                        if (aSeesB) {
                            assertThat(CandidateFilter.mutuallyAdmits(b, resolver.resolve(b), a, resolver.resolve(a))).isTrue();
                        }
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Own interactions, blocks against the viewer and restricted profiles are excluded")
    void exclusions() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        Profile passed = profile(2, Gender.MALE).build();
        Profile blockedViewer = profile(3, Gender.MALE).build();
        Profile banned = profile(4, Gender.MALE).banned(true).build();
        Profile hidden = profile(5, Gender.MALE).visible(false).build();
        Profile likedViewer = profile(6, Gender.MALE).build();
        Profile eligible = profile(7, Gender.MALE).build();
        directory.add(viewer, passed, blockedViewer, banned, hidden, likedViewer, eligible);

        LocalDateTime at = LocalDateTime.of(2025, 5, 1, 10, 0);
        interactions.upsert(1, 2, InteractionType.PASS, at);
        interactions.upsert(3, 1, InteractionType.BLOCK, at);
        interactions.upsert(6, 1, InteractionType.LIKE, at);

        assertThat(idsFor(viewer)).containsExactlyInAnyOrder(6L, 7L);
    }

    @Test
    @DisplayName("Blocks suppress in both directions")
    void exclusions_Bidirectional() {
        Profile a = profile(1, Gender.FEMALE).build();
        Profile b = profile(2, Gender.MALE).build();
        directory.add(a, b);
        interactions.upsert(1, 2, InteractionType.REPORT, LocalDateTime.of(2025, 5, 1, 10, 0));

        assertThat(idsFor(a)).isEmpty();
        assertThat(idsFor(b)).isEmpty();
    }

    @Test
    @DisplayName("Age bounds are inclusive on both ends")
    void ageFilter() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        directory.add(viewer,
                aged(2, Gender.MALE, 24),
                aged(3, Gender.MALE, 25),
                aged(4, Gender.MALE, 30),
                aged(5, Gender.MALE, 31));
        storedSettings.put(1L, DiscoverySettingsEntity.builder().userId(1L).minAge(25).maxAge(30).build());

        assertThat(idsFor(viewer)).containsExactlyInAnyOrder(3L, 4L);
    }

    @Test
    @DisplayName("Distance filter uses raw distance and admits unknown locations")
    void distanceFilter() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        Profile near = profile(2, Gender.MALE).build();
        Profile far = profile(3, Gender.MALE).geohash(PARIS).build();
        Profile unknown = profile(4, Gender.MALE).geohash(null).build();
        directory.add(viewer, near, far, unknown);

        assertThat(idsFor(viewer)).containsExactlyInAnyOrder(2L, 4L);

        storedSettings.put(1L, DiscoverySettingsEntity.builder().userId(1L).maxDistanceKm(500).build());
        assertThat(idsFor(viewer)).hasSize(2);
        storedSettings.put(1L, DiscoverySettingsEntity.builder().userId(1L).maxDistanceKm(900).build());
        assertThat(idsFor(viewer)).containsExactlyInAnyOrder(2L, 3L, 4L);
    }

    @Test
    @DisplayName("Ties on score go to the newer profile, then the lower id")
    void ranking_TieBreaks() {
        LocalDateTime base = LocalDateTime.of(2025, 3, 1, 0, 0);
        Profile viewer = profile(1, Gender.FEMALE).build();
        Profile older = profile(2, Gender.MALE).createdAt(base).build();
        Profile newerHighId = profile(4, Gender.MALE).createdAt(base.plusDays(1)).build();
        Profile newerLowId = profile(3, Gender.MALE).createdAt(base.plusDays(1)).build();
        Profile better = profile(5, Gender.MALE).createdAt(base).build();
        better.getInterests().add("chess");
        viewer.getInterests().add("chess");
        directory.add(viewer, older, newerHighId, newerLowId, better);

        assertThat(idsFor(viewer)).containsExactly(5L, 3L, 4L, 2L);
    }

    @Test
    void pageSize_Truncates() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        directory.add(viewer);
        for (long id = 2; id <= 12; id++) {
            directory.add(profile(id, Gender.MALE).build());
        }
        DiscoverySettings settings = resolver.resolve(viewer);

        List<ScoredCandidate> page = filter.findEligible(viewer, settings, 3);

        assertThat(page).hasSize(3);
        assertThat(page).isSorted();
    }

    @Test
    @DisplayName("A cached pool never resurfaces a profile the viewer has since swiped")
    void cachedPool_ExclusionsRecomputed() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        directory.add(viewer, profile(2, Gender.MALE).build(), profile(3, Gender.MALE).build());

        assertThat(idsFor(viewer)).containsExactlyInAnyOrder(2L, 3L);
        interactions.upsert(1, 2, InteractionType.LIKE, LocalDateTime.of(2025, 5, 1, 10, 0));

        assertThat(idsFor(viewer)).containsExactly(3L);
        assertThat(directory.candidateQueries()).isEqualTo(1);
    }

    @Test
    void buildQuery_BirthDateBoundsMatchAgeRange() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        DiscoverySettings settings = settings(1, GenderPreference.MALE).toBuilder().minAge(25).maxAge(30).build();

        CandidateCursor cursor = new CandidateCursor(LocalDateTime.of(2025, 1, 1, 0, 30), 30);

        CandidateQuery query = filter.buildQuery(viewer, settings, 10, TODAY, cursor);

        assertThat(query.bornOnOrBefore()).isEqualTo(TODAY.minusYears(25));
        assertThat(query.bornOnOrAfter()).isEqualTo(TODAY.minusYears(31).plusDays(1));
        assertThat(query.genders()).containsExactly(Gender.MALE);
        assertThat(query.viewerGender()).isEqualTo(Gender.FEMALE);
        assertThat(query.after()).isEqualTo(cursor);
        assertThat(query.limit()).isEqualTo(100);
    }

    @Test
    @DisplayName("An eligible profile behind two full pages of out-of-range profiles is still found")
    void eligibleBeyondFirstPool() {
        Profile viewer = profile(1, Gender.FEMALE).build();
        directory.add(viewer);
        for (long id = 2; id <= 200; id++) {
            directory.add(profile(id, Gender.MALE).geohash(PARIS).build());
        }
        directory.add(profile(500, Gender.MALE).createdAt(LocalDateTime.of(2024, 1, 1, 0, 0)).build());

        List<ScoredCandidate> page = filter.findEligible(viewer, resolver.resolve(viewer), 10);

        assertThat(page).extracting(c -> c.profile().getUserId()).containsExactly(500L);
        assertThat(directory.candidateQueries()).isEqualTo(3);
    }

    @Test
    @DisplayName("Ranking covers every page: the best match on a later page comes first")
    void rankingSpansPages() {
        Profile viewer = aged(1, Gender.FEMALE, 30, "hiking", "jazz", "chess");
        directory.add(viewer);
        for (long id = 2; id <= 150; id++) {
            directory.add(aged(id, Gender.MALE, 45, "golf"));
        }
        Profile best = profile(900, Gender.MALE)
                .interests(new HashSet<>(Set.of("hiking", "jazz", "chess")))
                .createdAt(LocalDateTime.of(2024, 1, 1, 0, 0))
                .build();
        directory.add(best);

        List<ScoredCandidate> page = filter.findEligible(viewer, resolver.resolve(viewer), 5);

        assertThat(page).hasSize(5);
        assertThat(page.get(0).profile().getUserId()).isEqualTo(900L);
        assertThat(page).isSorted();
    }

    @Test
    void scanStopsAtConfiguredCap() {
        properties.getCandidates().setMaxScannedProfiles(100);
        Profile viewer = profile(1, Gender.FEMALE).build();
        directory.add(viewer);
        for (long id = 2; id <= 200; id++) {
            directory.add(profile(id, Gender.MALE).geohash(PARIS).build());
        }
        directory.add(profile(500, Gender.MALE).createdAt(LocalDateTime.of(2024, 1, 1, 0, 0)).build());

        assertThat(filter.findEligible(viewer, resolver.resolve(viewer), 10)).isEmpty();
        assertThat(directory.candidateQueries()).isEqualTo(1);
    }
}
