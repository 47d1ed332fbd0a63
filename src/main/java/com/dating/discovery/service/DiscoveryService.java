package com.dating.discovery.service;

import com.dating.discovery.dto.*;
import com.dating.discovery.dto.enums.InteractionType;

import java.util.List;

public interface DiscoveryService {

    /**
     * Ranked candidates for a viewer. Not restartable: the pool shrinks as interactions accumulate.
     *
     * @param pageSize requested page size, or null for the configured default
     */
    List<CandidateView> getCandidates(long userId, Integer pageSize);

    /**
     * Records a swipe and, for positive types, checks for a match. Safe to retry except for superlikes,
     * whose quota is consumed by every committed call.
     */
    SwipeResponse swipe(long userId, long targetId, InteractionType type);

    List<MatchView> getMatches(long userId, int page, Integer size);

    List<IncomingLikeView> getIncomingLikes(long userId, Integer limit);

    DiscoverySettings getSettings(long userId);

    DiscoverySettings updateSettings(long userId, SettingsUpdateRequest request);

    QuotaStatus getQuotaStatus(long userId, String quotaName);

    /**
     * Bookmarks a profile. Repeating the call is a no-op that returns the original entry.
     */
    FavoriteView addFavorite(long userId, long targetId);

    /**
     * @throws com.dating.discovery.exceptions.NotFoundException when the favorite does not exist
     */
    void removeFavorite(long userId, long targetId);

    List<FavoriteView> getFavorites(long userId, int page, Integer size);
}
