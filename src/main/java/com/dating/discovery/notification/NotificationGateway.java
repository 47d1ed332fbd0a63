package com.dating.discovery.notification;

/**
 * Hands a newly created match to the delivery layer. Fire-and-forget: a failure here never affects the
 * stored match.
 */
public interface NotificationGateway {

    void notifyMatch(String matchId, long userA, long userB);
}
