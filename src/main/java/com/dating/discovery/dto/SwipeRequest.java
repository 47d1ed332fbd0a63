package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.InteractionType;
import com.dating.discovery.validation.ValidEnum;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwipeRequest {
    @NotNull
    @Positive
    private Long userId;

    @NotNull
    @Positive
    private Long targetId;

    @NotBlank
    @ValidEnum(enumClass = InteractionType.class, message = "must be one of like, pass, superlike, block, report")
    private String type;
}
