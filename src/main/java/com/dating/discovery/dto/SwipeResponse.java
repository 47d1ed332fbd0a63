package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.InteractionType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SwipeResponse {
    private boolean matched;
    private String matchId;
    private boolean newMatch;
    private InteractionType recordedType;
}
