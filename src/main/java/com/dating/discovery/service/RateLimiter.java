package com.dating.discovery.service;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.dto.QuotaStatus;
import com.dating.discovery.exceptions.NotFoundException;
import com.dating.discovery.models.RateLimitCounter;
import com.dating.discovery.processors.RateLimitStore;
import com.dating.discovery.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Store-backed quotas over a rolling window.
 * <p>
 * A window opens at the first consumption and lasts the configured duration. Once it has elapsed the
 * next consumption opens a new window with a count of one. Counters live in the shared store so every
 * engine instance sees the same state.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimiter {
    private final RateLimitStore rateLimitStore;
    private final DiscoveryProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @return true if one unit was consumed, false if the quota is exhausted for the current window
     */
    public boolean consume(long userId, String quotaName) {
        DiscoveryProperties.Quota quota = quota(quotaName);
        LocalDateTime now = LocalDateTime.now(clock);
        boolean consumed = rateLimitStore
                .tryConsume(userId, quotaName, quota.getLimit(), now, now.minus(quota.getWindow()))
                .isPresent();
        if (!consumed) {
            meterRegistry.counter(Constant.QUOTA_EXCEEDED_TOTAL, Constant.QUOTA, quotaName).increment();
            log.warn("Quota exhausted: userId={}, quota={}", userId, quotaName);
        }
        return consumed;
    }

    public QuotaStatus status(long userId, String quotaName) {
        DiscoveryProperties.Quota quota = quota(quotaName);
        Optional<RateLimitCounter> active = activeCounter(userId, quotaName, quota);
        int used = active.map(RateLimitCounter::getCount).orElse(0);
        return QuotaStatus.builder()
                .quota(quotaName)
                .limit(quota.getLimit())
                .used(used)
                .remaining(Math.max(0, quota.getLimit() - used))
                .resetsAt(active.map(c -> c.getWindowStart().plus(quota.getWindow())).orElse(null))
                .build();
    }

    /** Time left in the current window, if one is open. */
    public Optional<Duration> retryAfter(long userId, String quotaName) {
        DiscoveryProperties.Quota quota = quota(quotaName);
        LocalDateTime now = LocalDateTime.now(clock);
        return activeCounter(userId, quotaName, quota)
                .map(c -> Duration.between(now, c.getWindowStart().plus(quota.getWindow())))
                .filter(d -> !d.isNegative());
    }

    private Optional<RateLimitCounter> activeCounter(long userId, String quotaName, DiscoveryProperties.Quota quota) {
        LocalDateTime expiredAt = LocalDateTime.now(clock).minus(quota.getWindow());
        return rateLimitStore.find(userId, quotaName)
                .filter(c -> c.getWindowStart().isAfter(expiredAt));
    }

    private DiscoveryProperties.Quota quota(String quotaName) {
        return properties.getQuotas().byName(quotaName)
                .orElseThrow(() -> new NotFoundException("Unknown quota: " + quotaName));
    }
}
