package com.dating.discovery.dto;

import lombok.Builder;

import java.time.LocalDateTime;

@Builder
public record QuotaStatus(String quota, int limit, int used, int remaining, LocalDateTime resetsAt) {
}
