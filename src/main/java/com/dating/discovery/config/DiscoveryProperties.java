package com.dating.discovery.config;

import com.dating.discovery.dto.enums.GenderPreference;
import com.dating.discovery.utils.basic.Constant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Optional;

/**
 * Tunables bound from {@code discovery.*}. Every value has an in-code default so the engine starts
 * with an empty configuration.
 */
@Data
@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private Defaults defaults = new Defaults();
    private Candidates candidates = new Candidates();
    private Scoring scoring = new Scoring();
    private Quotas quotas = new Quotas();
    private Notifications notifications = new Notifications();

    @Data
    public static class Defaults {
        private int minAge = 18;
        private int maxAge = 99;
        private int maxDistanceKm = 50;
        private int maxDistanceCeilingKm = 500;
        private GenderPreference preferredGender = GenderPreference.ANY;
    }

    @Data
    public static class Candidates {
        private int defaultPageSize = 10;
        private int maxPageSize = 50;
        private int poolMultiplier = 5;
        private int minPoolSize = 100;
        private int maxPoolSize = 1000;
        private int maxScannedProfiles = 10_000;
        private Duration poolCacheTtl = Duration.ofSeconds(5);
        private long poolCacheMaxSize = 10_000;
        private int incomingLikesLimit = 20;

        public int poolSizeFor(int pageSize) {
            return Math.min(maxPoolSize, Math.max(minPoolSize, pageSize * poolMultiplier));
        }
    }

    @Data
    public static class Scoring {
        private int interestsWeight = 40;
        private int goalWeight = 25;
        private int ageWeight = 20;
        private int lifestyleWeight = 15;
        private double goalPartialCredit = 0.25;
        private int ageGapCeilingYears = 15;

        public int totalWeight() {
            return interestsWeight + goalWeight + ageWeight + lifestyleWeight;
        }
    }

    @Data
    public static class Quota {
        private int limit;
        private Duration window;

        public Quota() {
        }

        public Quota(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }
    }

    @Data
    public static class Quotas {
        private Quota superlikeDaily = new Quota(5, Duration.ofHours(24));
        private String cleanupCron = "0 15 * * * *";

        public Optional<Quota> byName(String quotaName) {
            if (Constant.SUPERLIKE_DAILY.equals(quotaName)) {
                return Optional.of(superlikeDaily);
            }
            return Optional.empty();
        }
    }

    @Data
    public static class Notifications {
        private String webhookUrl;
        private Duration webhookTimeout = Duration.ofSeconds(3);
    }
}
