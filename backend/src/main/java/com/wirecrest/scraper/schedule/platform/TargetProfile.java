package com.wirecrest.scraper.schedule.platform;

import com.wirecrest.scraper.schedule.model.TargetType;

public record TargetProfile(TargetType targetType, String identifier, String displayName) {
}
