package com.dating.discovery.models;

import com.dating.discovery.dto.enums.GenderPreference;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stored discovery preferences. Every column is nullable; missing values fall back to the configured
 * defaults when resolved.
 */
@Entity
@Table(name = "discovery_settings")
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoverySettingsEntity {
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "min_age")
    private Integer minAge;

    @Column(name = "max_age")
    private Integer maxAge;

    @Column(name = "max_distance_km")
    private Integer maxDistanceKm;

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_gender")
    private GenderPreference preferredGender;

    @Column(name = "hide_distance")
    private Boolean hideDistance;

    @Column(name = "hide_age")
    private Boolean hideAge;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
