package com.dating.discovery.processors;

import com.dating.discovery.models.RateLimitCounter;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Per-user quota counters over a rolling window that starts at the first consumption.
 */
public interface RateLimitStore {

    /**
     * Atomically starts a new window, increments the current one while below {@code limit}, or refuses.
     *
     * @param windowExpiredAt counters whose window started at or before this instant are expired
     * @return the count after consumption, or empty when the quota is exhausted
     */
    OptionalInt tryConsume(long userId, String quotaName, int limit, LocalDateTime now, LocalDateTime windowExpiredAt);

    Optional<RateLimitCounter> find(long userId, String quotaName);

    int deleteExpired(String quotaName, LocalDateTime windowExpiredAt);
}
