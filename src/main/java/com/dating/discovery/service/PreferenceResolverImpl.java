package com.dating.discovery.service;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.directory.ProfileDirectory;
import com.dating.discovery.dto.DiscoverySettings;
import com.dating.discovery.dto.SettingsUpdateRequest;
import com.dating.discovery.dto.enums.GenderPreference;
import com.dating.discovery.exceptions.InvalidOperationException;
import com.dating.discovery.models.DiscoverySettingsEntity;
import com.dating.discovery.models.Profile;
import com.dating.discovery.repo.DiscoverySettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;


@Slf4j
@Service
@RequiredArgsConstructor
public class PreferenceResolverImpl implements PreferenceResolver {
    private final ProfileDirectory profileDirectory;
    private final DiscoverySettingsRepository settingsRepository;
    private final DiscoveryProperties properties;
    private final Clock clock;

    @Override
    public DiscoverySettings resolve(long userId) {
        return resolve(profileDirectory.getProfile(userId));
    }

    @Override
    public DiscoverySettings resolve(Profile profile) {
        return merge(profile, settingsRepository.findById(profile.getUserId()).orElse(null));
    }

    @Override
    public Map<Long, DiscoverySettings> resolveAll(Collection<Profile> profiles) {
        if (profiles.isEmpty()) {
            return Map.of();
        }
        Set<Long> ids = profiles.stream().map(Profile::getUserId).collect(Collectors.toSet());
        Map<Long, DiscoverySettingsEntity> stored = settingsRepository.findByUserIdIn(ids).stream()
                .collect(Collectors.toMap(DiscoverySettingsEntity::getUserId, Function.identity()));

        Map<Long, DiscoverySettings> resolved = new HashMap<>(profiles.size());
        for (Profile profile : profiles) {
            resolved.put(profile.getUserId(), merge(profile, stored.get(profile.getUserId())));
        }
        return resolved;
    }

    @Override
    @Transactional
    public DiscoverySettings update(long userId, SettingsUpdateRequest request) {
        Profile profile = profileDirectory.getProfile(userId);
        DiscoverySettingsEntity entity = settingsRepository.findById(userId)
                .orElseGet(() -> DiscoverySettingsEntity.builder().userId(userId).build());

        if (request.getMinAge() != null) entity.setMinAge(request.getMinAge());
        if (request.getMaxAge() != null) entity.setMaxAge(request.getMaxAge());
        if (request.getMaxDistanceKm() != null) entity.setMaxDistanceKm(request.getMaxDistanceKm());
        if (request.getPreferredGender() != null) entity.setPreferredGender(request.getPreferredGender());
        if (request.getHideDistance() != null) entity.setHideDistance(request.getHideDistance());
        if (request.getHideAge() != null) entity.setHideAge(request.getHideAge());

        validate(entity);
        entity.setUpdatedAt(LocalDateTime.now(clock));
        settingsRepository.save(entity);
        log.info("Discovery settings updated for userId={}", userId);
        return merge(profile, entity);
    }

    private void validate(DiscoverySettingsEntity entity) {
        DiscoveryProperties.Defaults defaults = properties.getDefaults();
        int minAge = ObjectUtils.defaultIfNull(entity.getMinAge(), defaults.getMinAge());
        int maxAge = ObjectUtils.defaultIfNull(entity.getMaxAge(), defaults.getMaxAge());
        int maxDistance = ObjectUtils.defaultIfNull(entity.getMaxDistanceKm(), defaults.getMaxDistanceKm());

        if (minAge < defaults.getMinAge()) {
            throw new InvalidOperationException("Minimum age cannot be below " + defaults.getMinAge());
        }
        if (minAge > maxAge) {
            throw new InvalidOperationException("Minimum age " + minAge + " exceeds maximum age " + maxAge);
        }
        if (maxDistance <= 0 || maxDistance > defaults.getMaxDistanceCeilingKm()) {
            throw new InvalidOperationException("Maximum distance must be between 1 and "
                    + defaults.getMaxDistanceCeilingKm() + " km");
        }
    }

    /*
     * Stored rows written before a ceiling change can fall outside the current bounds; they are clamped
     * rather than rejected.
     */
    private DiscoverySettings merge(Profile profile, DiscoverySettingsEntity stored) {
        DiscoveryProperties.Defaults defaults = properties.getDefaults();
        Optional<DiscoverySettingsEntity> row = Optional.ofNullable(stored);

        int minAge = Math.max(defaults.getMinAge(),
                row.map(DiscoverySettingsEntity::getMinAge).orElse(defaults.getMinAge()));
        int maxAge = Math.max(minAge, row.map(DiscoverySettingsEntity::getMaxAge).orElse(defaults.getMaxAge()));
        int maxDistance = Math.min(defaults.getMaxDistanceCeilingKm(),
                Math.max(1, row.map(DiscoverySettingsEntity::getMaxDistanceKm).orElse(defaults.getMaxDistanceKm())));
        GenderPreference preference = row.map(DiscoverySettingsEntity::getPreferredGender)
                .or(() -> Optional.ofNullable(profile.getOrientation()))
                .orElse(defaults.getPreferredGender());

        return DiscoverySettings.builder()
                .userId(profile.getUserId())
                .minAge(minAge)
                .maxAge(maxAge)
                .maxDistanceKm(maxDistance)
                .preferredGender(preference)
                .hideDistance(row.map(DiscoverySettingsEntity::getHideDistance).orElse(false))
                .hideAge(row.map(DiscoverySettingsEntity::getHideAge).orElse(false))
                .build();
    }
}
