package com.dating.discovery.directory;

import com.dating.discovery.models.Profile;
import org.springframework.stereotype.Component;

/**
 * Reads the ban and visibility flags maintained on the profile row by the moderation service.
 */
@Component
public class ProfileModerationSignal implements ModerationSignal {

    @Override
    public boolean isRestricted(Profile profile) {
        return profile.isBanned() || !profile.isVisible();
    }
}
