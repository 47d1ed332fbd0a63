package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.InteractionType;
import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record IncomingLikeView(long userId, String name, InteractionType type, LocalDateTime likedAt) {
}
