package com.dating.discovery.dto;

import com.dating.discovery.models.Profile;

import java.util.List;

public record CandidatePage(
        List<Profile> profiles,
        boolean hasMore,
        CandidateCursor next) {

    public static CandidatePage empty() {
        return new CandidatePage(List.of(), false, null);
    }
}
