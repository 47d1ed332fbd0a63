package com.dating.discovery.dto;

import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record FavoriteView(long userId, String name, LocalDateTime favoritedAt) {
}
