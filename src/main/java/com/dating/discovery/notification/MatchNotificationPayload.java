package com.dating.discovery.notification;

public record MatchNotificationPayload(String matchId, long userA, long userB) {
}
