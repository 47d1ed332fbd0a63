package com.dating.discovery.service;

import com.dating.discovery.dto.DiscoverySettings;
import com.dating.discovery.dto.SettingsUpdateRequest;
import com.dating.discovery.models.Profile;

import java.util.Collection;
import java.util.Map;

public interface PreferenceResolver {

    /**
     * @throws com.dating.discovery.exceptions.NotFoundException if the user has no profile
     */
    DiscoverySettings resolve(long userId);

    DiscoverySettings resolve(Profile profile);

    Map<Long, DiscoverySettings> resolveAll(Collection<Profile> profiles);

    /**
     * Applies the non-null fields of {@code request} over the stored settings.
     *
     * @throws com.dating.discovery.exceptions.InvalidOperationException if the merged settings are inconsistent
     */
    DiscoverySettings update(long userId, SettingsUpdateRequest request);
}
