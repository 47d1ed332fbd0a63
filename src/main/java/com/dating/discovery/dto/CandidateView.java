package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.Gender;
import com.dating.discovery.dto.enums.Goal;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateView {
    private long userId;
    private String name;
    private Integer age;
    private Gender gender;
    private Goal goal;
    private Set<String> interests;
    private Set<String> sharedInterests;
    private Integer distanceKm;
    private String distanceLabel;
    private int compatibilityScore;
}
