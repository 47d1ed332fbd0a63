package com.dating.discovery.service;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.models.Profile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;


@Slf4j
@Component
public class WeightedCompatibilityScorer implements CompatibilityScorer {
    private static final double UNKNOWN_LIFESTYLE_CREDIT = 0.5;
    private static final int MAX_SCORE = 100;

    private final DiscoveryProperties.Scoring scoring;

    public WeightedCompatibilityScorer(DiscoveryProperties properties) {
        this.scoring = properties.getScoring();
    }

    @PostConstruct
    void checkWeights() {
        if (scoring.totalWeight() != MAX_SCORE) {
            log.warn("Compatibility weights sum to {} instead of {}; scores are clamped to [0, {}]",
                    scoring.totalWeight(), MAX_SCORE, MAX_SCORE);
        }
    }

    @Override
    public int score(Profile a, Profile b, LocalDate today) {
        double total = scoring.getInterestsWeight() * interestSimilarity(a, b)
                + scoring.getGoalWeight() * goalAlignment(a, b)
                + scoring.getAgeWeight() * ageProximity(a, b, today)
                + scoring.getLifestyleWeight() * lifestyleCompatibility(a, b);
        return (int) Math.max(0, Math.min(MAX_SCORE, Math.round(total)));
    }

    /** Jaccard index of the normalised interest sets; 0 when both are empty. */
    double interestSimilarity(Profile a, Profile b) {
        Set<String> first = normalise(a.getInterests());
        Set<String> second = normalise(b.getInterests());
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> shared = new HashSet<>(first);
        shared.retainAll(second);
        return (double) shared.size() / union.size();
    }

    double goalAlignment(Profile a, Profile b) {
        if (a.getGoal() != null && a.getGoal() == b.getGoal()) {
            return 1.0;
        }
        return scoring.getGoalPartialCredit();
    }

    double ageProximity(Profile a, Profile b, LocalDate today) {
        int gap = Math.abs(a.ageOn(today) - b.ageOn(today));
        return Math.max(0.0, 1.0 - (double) gap / scoring.getAgeGapCeilingYears());
    }

    double lifestyleCompatibility(Profile a, Profile b) {
        return (axis(a, b, Profile::getSmoking)
                + axis(a, b, Profile::getDrinking)
                + axis(a, b, Profile::getChildren)) / 3.0;
    }

    private static double axis(Profile a, Profile b, Function<Profile, String> attribute) {
        String first = attribute.apply(a);
        String second = attribute.apply(b);
        if (StringUtils.isBlank(first) || StringUtils.isBlank(second)) {
            return UNKNOWN_LIFESTYLE_CREDIT;
        }
        return first.trim().equalsIgnoreCase(second.trim()) ? 1.0 : 0.0;
    }

    static Set<String> normalise(Set<String> interests) {
        if (interests == null) {
            return Set.of();
        }
        return interests.stream()
                .filter(StringUtils::isNotBlank)
                .map(i -> i.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
