package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.GenderPreference;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial settings update. Null fields keep their stored value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettingsUpdateRequest {
    @Min(value = 18, message = "minimum age cannot be below 18")
    @Max(120)
    private Integer minAge;

    @Min(value = 18, message = "maximum age cannot be below 18")
    @Max(120)
    private Integer maxAge;

    @Positive
    private Integer maxDistanceKm;

    private GenderPreference preferredGender;
    private Boolean hideDistance;
    private Boolean hideAge;
}
