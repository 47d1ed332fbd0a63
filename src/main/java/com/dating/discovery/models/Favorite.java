package com.dating.discovery.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A one-directional bookmark from {@code userId} to {@code targetId}. Independent of interactions.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Favorite {
    private long userId;
    private long targetId;
    private LocalDateTime createdAt;
}
