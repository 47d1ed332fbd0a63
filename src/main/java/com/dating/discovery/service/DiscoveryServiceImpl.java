package com.dating.discovery.service;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.directory.ModerationSignal;
import com.dating.discovery.directory.ProfileDirectory;
import com.dating.discovery.dto.*;
import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.exceptions.BadRequestException;
import com.dating.discovery.exceptions.InvalidOperationException;
import com.dating.discovery.exceptions.NotFoundException;
import com.dating.discovery.models.Favorite;
import com.dating.discovery.models.Interaction;
import com.dating.discovery.models.Match;
import com.dating.discovery.models.Profile;
import com.dating.discovery.notification.MatchNotifier;
import com.dating.discovery.processors.FavoriteStore;
import com.dating.discovery.processors.InteractionStore;
import com.dating.discovery.processors.MatchStore;
import com.dating.discovery.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;


@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryServiceImpl implements DiscoveryService {
    private final ProfileDirectory profileDirectory;
    private final PreferenceResolver preferenceResolver;
    private final CandidateFilter candidateFilter;
    private final DistanceCalculator distanceCalculator;
    private final InteractionRecorder interactionRecorder;
    private final MatchDetector matchDetector;
    private final MatchNotifier matchNotifier;
    private final RateLimiter rateLimiter;
    private final InteractionStore interactionStore;
    private final MatchStore matchStore;
    private final FavoriteStore favoriteStore;
    private final ModerationSignal moderationSignal;
    private final DiscoveryProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public List<CandidateView> getCandidates(long userId, Integer pageSize) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Profile viewer = profileDirectory.getProfile(userId);
            DiscoverySettings settings = preferenceResolver.resolve(viewer);
            int size = pageSize("pageSize", pageSize, properties.getCandidates().getDefaultPageSize());

            LocalDate today = LocalDate.now(clock);
            List<CandidateView> views = candidateFilter.findEligible(viewer, settings, size).stream()
                    .map(candidate -> toView(viewer, settings, candidate, today))
                    .toList();

            meterRegistry.counter(Constant.CANDIDATES_SERVED_TOTAL).increment(views.size());
            log.debug("Served {} candidates to userId={}", views.size(), userId);
            return views;
        } finally {
            sample.stop(meterRegistry.timer(Constant.CANDIDATES_DURATION));
        }
    }

    @Override
    public SwipeResponse swipe(long userId, long targetId, InteractionType type) {
        if (userId == targetId) {
            throw new InvalidOperationException("User " + userId + " cannot interact with themselves");
        }
        profileDirectory.getProfile(userId);
        profileDirectory.getProfile(targetId);

        RecordedInteraction recorded = interactionRecorder.record(userId, targetId, type);
        if (recorded.suppressed() || !recorded.stored().isPositive()) {
            return SwipeResponse.builder().matched(false).recordedType(recorded.stored()).build();
        }

        MatchOutcome outcome = matchDetector.detect(userId, targetId);
        if (!outcome.matched()) {
            return SwipeResponse.builder().matched(false).recordedType(recorded.stored()).build();
        }
        if (outcome.created()) {
            matchNotifier.dispatch(outcome.match());
        }
        return SwipeResponse.builder()
                .matched(true)
                .matchId(String.valueOf(outcome.match().getId()))
                .newMatch(outcome.created())
                .recordedType(recorded.stored())
                .build();
    }

    @Override
    public List<MatchView> getMatches(long userId, int page, Integer size) {
        if (page < 0) {
            throw new BadRequestException("page", page, "must not be negative");
        }
        profileDirectory.getProfile(userId);
        int pageSize = pageSize("size", size, properties.getCandidates().getDefaultPageSize());

        List<Match> matches = matchStore.findByUser(userId, page * pageSize, pageSize);
        Map<Long, Profile> counterparts = profileDirectory.getProfiles(matches.stream()
                .map(m -> m.counterpartOf(userId))
                .collect(Collectors.toSet()));

        return matches.stream()
                .map(m -> {
                    long other = m.counterpartOf(userId);
                    return MatchView.builder()
                            .matchId(String.valueOf(m.getId()))
                            .userId(other)
                            .name(Optional.ofNullable(counterparts.get(other)).map(Profile::getName).orElse(null))
                            .matchedAt(m.getCreatedAt())
                            .build();
                })
                .toList();
    }

    @Override
    public List<IncomingLikeView> getIncomingLikes(long userId, Integer limit) {
        profileDirectory.getProfile(userId);
        int max = pageSize("limit", limit, properties.getCandidates().getIncomingLikesLimit());

        List<Interaction> likes = interactionStore.findUnansweredPositive(userId, max);
        Map<Long, Profile> actors = profileDirectory.getProfiles(likes.stream()
                .map(Interaction::getActorId)
                .collect(Collectors.toSet()));

        List<IncomingLikeView> views = new ArrayList<>(likes.size());
        for (Interaction like : likes) {
            Profile actor = actors.get(like.getActorId());
            if (actor == null || moderationSignal.isRestricted(actor)) {
                continue;
            }
            views.add(IncomingLikeView.builder()
                    .userId(actor.getUserId())
                    .name(actor.getName())
                    .type(like.getType())
                    .likedAt(like.getUpdatedAt())
                    .build());
        }
        return views;
    }

    @Override
    public DiscoverySettings getSettings(long userId) {
        return preferenceResolver.resolve(userId);
    }

    @Override
    public DiscoverySettings updateSettings(long userId, SettingsUpdateRequest request) {
        return preferenceResolver.update(userId, request);
    }

    @Override
    public QuotaStatus getQuotaStatus(long userId, String quotaName) {
        profileDirectory.getProfile(userId);
        return rateLimiter.status(userId, quotaName);
    }

    @Override
    public FavoriteView addFavorite(long userId, long targetId) {
        if (userId == targetId) {
            throw new InvalidOperationException("User " + userId + " cannot favorite themselves");
        }
        profileDirectory.getProfile(userId);
        Profile target = profileDirectory.getProfile(targetId);

        Favorite favorite = favoriteStore.addIfAbsent(userId, targetId, LocalDateTime.now(clock));
        log.info("Favorite saved: userId={}, targetId={}", userId, targetId);
        return toFavoriteView(favorite, target);
    }

    @Override
    public void removeFavorite(long userId, long targetId) {
        if (!favoriteStore.remove(userId, targetId)) {
            throw new NotFoundException("Favorite not found: userId=" + userId + ", targetId=" + targetId);
        }
        log.info("Favorite removed: userId={}, targetId={}", userId, targetId);
    }

    @Override
    public List<FavoriteView> getFavorites(long userId, int page, Integer size) {
        if (page < 0) {
            throw new BadRequestException("page", page, "must not be negative");
        }
        profileDirectory.getProfile(userId);
        int pageSize = pageSize("size", size, properties.getCandidates().getDefaultPageSize());

        List<Favorite> favorites = favoriteStore.findByUser(userId, page * pageSize, pageSize);
        Map<Long, Profile> targets = profileDirectory.getProfiles(favorites.stream()
                .map(Favorite::getTargetId)
                .collect(Collectors.toSet()));

        List<FavoriteView> views = new ArrayList<>(favorites.size());
        for (Favorite favorite : favorites) {
            Profile target = targets.get(favorite.getTargetId());
            if (target == null || moderationSignal.isRestricted(target)) {
                continue;
            }
            views.add(toFavoriteView(favorite, target));
        }
        return views;
    }

    private static FavoriteView toFavoriteView(Favorite favorite, Profile target) {
        return FavoriteView.builder()
                .userId(target.getUserId())
                .name(target.getName())
                .favoritedAt(favorite.getCreatedAt())
                .build();
    }

    private CandidateView toView(Profile viewer, DiscoverySettings viewerSettings, ScoredCandidate candidate, LocalDate today) {
        Profile profile = candidate.profile();
        boolean hideAge = candidate.settings() != null && candidate.settings().hideAge();
        boolean hideDistance = viewerSettings.hideDistance()
                || (candidate.settings() != null && candidate.settings().hideDistance());
        DistanceView distance = distanceCalculator.display(candidate.distanceKm(), hideDistance);

        Set<String> shared = new TreeSet<>(WeightedCompatibilityScorer.normalise(viewer.getInterests()));
        shared.retainAll(WeightedCompatibilityScorer.normalise(profile.getInterests()));

        return CandidateView.builder()
                .userId(profile.getUserId())
                .name(profile.getName())
                .age(hideAge ? null : profile.ageOn(today))
                .gender(profile.getGender())
                .goal(profile.getGoal())
                .interests(new TreeSet<>(profile.getInterests()))
                .sharedInterests(shared)
                .distanceKm(distance.km())
                .distanceLabel(distance.label())
                .compatibilityScore(candidate.score())
                .build();
    }

    private int pageSize(String parameter, Integer requested, int defaultSize) {
        if (requested == null) {
            return defaultSize;
        }
        if (requested < 1) {
            throw new BadRequestException(parameter, requested, "must be at least 1");
        }
        return Math.min(requested, properties.getCandidates().getMaxPageSize());
    }
}
