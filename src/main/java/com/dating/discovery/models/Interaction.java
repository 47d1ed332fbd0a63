package com.dating.discovery.models;

import com.dating.discovery.dto.enums.InteractionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Interaction {
    private long actorId;
    private long targetId;
    private InteractionType type;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
