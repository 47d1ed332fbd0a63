package com.dating.discovery.models;

import com.dating.discovery.dto.enums.Gender;
import com.dating.discovery.dto.enums.GenderPreference;
import com.dating.discovery.dto.enums.Goal;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.HashSet;
import java.util.Set;

/**
 * Read-only view of a profile row. The profile-management service owns these rows; the engine never
 * writes them.
 */
@Entity
@Immutable
@Table(name = "profiles")
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Profile {
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(nullable = false)
    private String name;

    @Column(name = "birth_date", nullable = false)
    private LocalDate birthDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Gender gender;

    @Enumerated(EnumType.STRING)
    private GenderPreference orientation;

    private String geohash;

    @Builder.Default
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "profile_interests", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "interest")
    private Set<String> interests = new HashSet<>();

    @Enumerated(EnumType.STRING)
    private Goal goal;

    private String smoking;

    private String drinking;

    private String children;

    @Builder.Default
    @Column(name = "is_visible", nullable = false)
    private boolean visible = true;

    @Column(name = "is_banned", nullable = false)
    private boolean banned;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public int ageOn(LocalDate today) {
        return Period.between(birthDate, today).getYears();
    }
}
