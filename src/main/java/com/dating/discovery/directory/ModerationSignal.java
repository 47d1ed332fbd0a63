package com.dating.discovery.directory;

import com.dating.discovery.models.Profile;

/**
 * Whether a profile is currently barred from being surfaced to anyone.
 */
public interface ModerationSignal {

    boolean isRestricted(Profile profile);
}
