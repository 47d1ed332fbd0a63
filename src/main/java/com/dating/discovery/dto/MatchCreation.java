package com.dating.discovery.dto;

import com.dating.discovery.models.Match;

public record MatchCreation(Match match, boolean created) {
}
