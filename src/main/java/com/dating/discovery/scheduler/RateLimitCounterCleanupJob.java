package com.dating.discovery.scheduler;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.processors.RateLimitStore;
import com.dating.discovery.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Deletes counters whose window has elapsed. Expired rows are already ignored by consumption, so this
 * only bounds table growth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitCounterCleanupJob {
    private final RateLimitStore rateLimitStore;
    private final DiscoveryProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(cron = "${discovery.quotas.cleanup-cron:0 15 * * * *}")
    public void purgeExpiredCounters() {
        long start = System.currentTimeMillis();
        LocalDateTime now = LocalDateTime.now(clock);
        DiscoveryProperties.Quota quota = properties.getQuotas().getSuperlikeDaily();
        try {
            int purged = rateLimitStore.deleteExpired(Constant.SUPERLIKE_DAILY, now.minus(quota.getWindow()));
            meterRegistry.counter(Constant.COUNTERS_PURGED_TOTAL, Constant.QUOTA, Constant.SUPERLIKE_DAILY)
                    .increment(purged);
            if (purged > 0) {
                log.info("Purged {} expired {} counters", purged, Constant.SUPERLIKE_DAILY);
            }
        } catch (DataAccessException e) {
            log.warn("Rate-limit counter cleanup failed, will retry on next run", e);
        }
        log.debug("Rate-limit counter cleanup completed in {}ms", System.currentTimeMillis() - start);
    }
}
