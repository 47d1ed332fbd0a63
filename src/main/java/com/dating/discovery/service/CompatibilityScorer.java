package com.dating.discovery.service;

import com.dating.discovery.models.Profile;

import java.time.LocalDate;

/**
 * Deterministic compatibility in {@code [0, 100]}. Implementations are symmetric:
 * {@code score(a, b, d) == score(b, a, d)}.
 */
public interface CompatibilityScorer {
    int score(Profile a, Profile b, LocalDate today);
}
