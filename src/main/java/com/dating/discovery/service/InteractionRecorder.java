package com.dating.discovery.service;

import com.dating.discovery.dto.RecordedInteraction;
import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.exceptions.InvalidOperationException;
import com.dating.discovery.exceptions.QuotaExceededException;
import com.dating.discovery.processors.InteractionStore;
import com.dating.discovery.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes swipes. Each call is one transaction holding the quota increment (for superlikes) and the
 * single-row upsert, so a refused superlike leaves nothing behind. A superlike toward a pair the actor
 * already blocked or reported is recorded as suppressed without touching the quota.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InteractionRecorder {
    private final InteractionStore interactionStore;
    private final RateLimiter rateLimiter;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RecordedInteraction record(long actorId, long targetId, InteractionType type) {
        if (actorId == targetId) {
            throw new InvalidOperationException("User " + actorId + " cannot interact with themselves");
        }
        if (type == null) {
            throw new InvalidOperationException("Interaction type is required");
        }

        RecordedInteraction recorded = transactionTemplate.execute(status -> {
            // a superlike over a block or report cannot change the row, so it costs nothing
            if (type == InteractionType.SUPERLIKE && !storedTerminal(actorId, targetId)
                    && !rateLimiter.consume(actorId, Constant.SUPERLIKE_DAILY)) {
                throw new QuotaExceededException(Constant.SUPERLIKE_DAILY,
                        rateLimiter.retryAfter(actorId, Constant.SUPERLIKE_DAILY).orElse(null));
            }
            InteractionType stored = interactionStore.upsert(actorId, targetId, type, LocalDateTime.now(clock));
            return new RecordedInteraction(actorId, targetId, type, stored);
        });

        meterRegistry.counter(Constant.SWIPES_TOTAL, Constant.TYPE, type.getValue()).increment();
        if (recorded.suppressed()) {
            log.info("Interaction {}->{} kept as {}, requested {}", actorId, targetId, recorded.stored(), type);
        }
        return recorded;
    }

    private boolean storedTerminal(long actorId, long targetId) {
        return interactionStore.find(actorId, targetId)
                .map(i -> i.getType().isTerminal())
                .orElse(false);
    }
}
