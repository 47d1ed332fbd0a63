package com.dating.discovery.service;

import com.dating.discovery.dto.MatchCreation;
import com.dating.discovery.dto.MatchOutcome;
import com.dating.discovery.models.Interaction;
import com.dating.discovery.processors.InteractionStore;
import com.dating.discovery.processors.MatchStore;
import com.dating.discovery.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Turns reciprocal positive interactions into a match.
 * <p>
 * Runs after the caller's interaction has committed. Both stored rows are read, so a pair where either
 * side now holds a block or report never matches. Creation is insert-or-ignore on the canonical pair:
 * when two reciprocal swipes race, both see the match and exactly one reports it as created.
 * </p>
 */
@Slf4j
@Component
public class MatchDetector {
    private final InteractionStore interactionStore;
    private final MatchStore matchStore;
    private final RetryTemplate matchRetryTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public MatchDetector(InteractionStore interactionStore,
                         MatchStore matchStore,
                         @Qualifier("matchRetryTemplate") RetryTemplate matchRetryTemplate,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.interactionStore = interactionStore;
        this.matchStore = matchStore;
        this.matchRetryTemplate = matchRetryTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public MatchOutcome detect(long actorId, long targetId) {
        if (!isPositive(interactionStore.find(actorId, targetId))
                || !isPositive(interactionStore.find(targetId, actorId))) {
            return MatchOutcome.noMatch();
        }

        long low = Math.min(actorId, targetId);
        long high = Math.max(actorId, targetId);
        MatchCreation creation = matchRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying match creation {}-{} (attempt {})", low, high, context.getRetryCount() + 1);
            }
            return matchStore.insertIfAbsent(low, high, LocalDateTime.now(clock));
        });

        if (creation.created()) {
            meterRegistry.counter(Constant.MATCHES_CREATED_TOTAL).increment();
            log.info("Match created: matchId={}, users={}<->{}", creation.match().getId(), low, high);
            return MatchOutcome.newlyMatched(creation.match());
        }
        meterRegistry.counter(Constant.MATCHES_EXISTING_TOTAL).increment();
        return MatchOutcome.alreadyMatched(creation.match());
    }

    private static boolean isPositive(Optional<Interaction> interaction) {
        return interaction.map(i -> i.getType().isPositive()).orElse(false);
    }
}
