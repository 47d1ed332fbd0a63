package com.dating.discovery.dto;

import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record MatchView(String matchId, long userId, String name, LocalDateTime matchedAt) {
}
