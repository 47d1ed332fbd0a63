package com.dating.discovery.dto;

import java.time.LocalDateTime;

/**
 * Keyset position in the candidate scan: the last row returned, in {@code created_at DESC, user_id DESC}
 * order.
 */
public record CandidateCursor(LocalDateTime createdAt, long userId) {
}
