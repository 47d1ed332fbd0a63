package com.dating.discovery.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class RateLimitCounter {
    private long userId;
    private String quotaName;
    private LocalDateTime windowStart;
    private int count;
}
