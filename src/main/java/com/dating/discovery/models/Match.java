package com.dating.discovery.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A mutual match. The pair is stored canonically with {@code userLowId < userHighId}.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Match {
    private long id;
    private long userLowId;
    private long userHighId;
    private LocalDateTime createdAt;

    public long counterpartOf(long userId) {
        return userId == userLowId ? userHighId : userLowId;
    }
}
