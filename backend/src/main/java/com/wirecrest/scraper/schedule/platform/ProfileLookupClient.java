package com.wirecrest.scraper.schedule.platform;

import com.wirecrest.scraper.schedule.model.TargetType;

/**
 * Resolves a configured identifier to the public profile it points at. Throws {@link JobPlatformException}
 * with code {@code profile_not_found} when the platform has no such profile.
 */
public interface ProfileLookupClient {

    TargetProfile fetchProfile(TargetType targetType, String identifier);
}
