package com.dating.discovery.notification;

import com.dating.discovery.models.Match;
import com.dating.discovery.utils.basic.Constant;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Dispatches match notifications off the request thread.
 */
@Slf4j
@Component
public class MatchNotifier {
    private final NotificationGateway notificationGateway;
    private final Executor notificationExecutor;
    private final MeterRegistry meterRegistry;

    public MatchNotifier(NotificationGateway notificationGateway,
                         @Qualifier("notificationExecutor") Executor notificationExecutor,
                         MeterRegistry meterRegistry) {
        this.notificationGateway = notificationGateway;
        this.notificationExecutor = notificationExecutor;
        this.meterRegistry = meterRegistry;
    }

    public void dispatch(Match match) {
        String matchId = String.valueOf(match.getId());
        notificationExecutor.execute(() -> {
            try {
                notificationGateway.notifyMatch(matchId, match.getUserLowId(), match.getUserHighId());
            } catch (RuntimeException e) {
                log.error("Match notification failed for matchId={}", matchId, e);
                meterRegistry.counter(Constant.NOTIFICATIONS_FAILED_TOTAL, "reason", "gateway").increment();
            }
        });
    }
}
