package com.dating.discovery.repo;

import java.time.LocalDateTime;

public interface CandidateCursorProjection {
    Long getUserId();
    LocalDateTime getCreatedAt();
}
