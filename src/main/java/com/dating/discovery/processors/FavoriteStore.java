package com.dating.discovery.processors;

import com.dating.discovery.models.Favorite;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface FavoriteStore {

    /**
     * Idempotent add. A repeated add keeps the original row and its {@code createdAt}.
     *
     * @return the stored favorite
     */
    Favorite addIfAbsent(long userId, long targetId, LocalDateTime at);

    /**
     * @return true if a row was deleted
     */
    boolean remove(long userId, long targetId);

    Optional<Favorite> find(long userId, long targetId);

    /** Favorites saved by {@code userId}, newest first. */
    List<Favorite> findByUser(long userId, int offset, int limit);
}
