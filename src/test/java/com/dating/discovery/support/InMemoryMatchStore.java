package com.dating.discovery.support;

import com.dating.discovery.dto.MatchCreation;
import com.dating.discovery.models.Match;
import com.dating.discovery.processors.MatchStore;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryMatchStore implements MatchStore {
    private record Pair(long low, long high) {
    }

    private final Map<Pair, Match> rows = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public synchronized int size() {
        return rows.size();
    }

    @Override
    public synchronized MatchCreation insertIfAbsent(long userLowId, long userHighId, LocalDateTime at) {
        if (userLowId >= userHighId) {
            throw new IllegalArgumentException("unordered pair");
        }
        Pair pair = new Pair(userLowId, userHighId);
        Match existing = rows.get(pair);
        if (existing != null) {
            return new MatchCreation(existing, false);
        }
        Match created = new Match(ids.incrementAndGet(), userLowId, userHighId, at);
        rows.put(pair, created);
        return new MatchCreation(created, true);
    }

    @Override
    public synchronized Optional<Match> find(long userLowId, long userHighId) {
        return Optional.ofNullable(rows.get(new Pair(userLowId, userHighId)));
    }

    @Override
    public synchronized List<Match> findByUser(long userId, int offset, int limit) {
        return rows.values().stream()
                .filter(m -> m.getUserLowId() == userId || m.getUserHighId() == userId)
                .sorted(Comparator.comparing(Match::getCreatedAt).thenComparing(Match::getId).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
    }
}
