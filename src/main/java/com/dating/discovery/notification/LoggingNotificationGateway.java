package com.dating.discovery.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * Used when no webhook is configured.
 */
@Slf4j
@Component
@ConditionalOnExpression("'${discovery.notifications.webhook-url:}'.isEmpty()")
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public void notifyMatch(String matchId, long userA, long userB) {
        log.info("Match created: matchId={}, users={}<->{}", matchId, userA, userB);
    }
}
