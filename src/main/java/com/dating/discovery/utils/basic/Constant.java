package com.dating.discovery.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String SUPERLIKE_DAILY = "superlike_daily";

    public static final String TYPE = "type";
    public static final String QUOTA = "quota";
    public static final String OUTCOME = "outcome";

    public static final String SWIPES_TOTAL = "discovery_swipes_total";
    public static final String MATCHES_CREATED_TOTAL = "discovery_matches_created_total";
    public static final String MATCHES_EXISTING_TOTAL = "discovery_matches_existing_total";
    public static final String QUOTA_EXCEEDED_TOTAL = "discovery_quota_exceeded_total";
    public static final String CANDIDATES_SERVED_TOTAL = "discovery_candidates_served_total";
    public static final String CANDIDATES_DURATION = "discovery_candidates_duration";
    public static final String NOTIFICATIONS_FAILED_TOTAL = "discovery_match_notifications_failed_total";
    public static final String COUNTERS_PURGED_TOTAL = "discovery_rate_limit_counters_purged_total";
}
