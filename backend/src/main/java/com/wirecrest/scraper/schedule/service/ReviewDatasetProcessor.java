package com.wirecrest.scraper.schedule.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wirecrest.scraper.schedule.model.DatasetProcessingResult;
import com.wirecrest.scraper.schedule.model.TargetType;

import java.util.List;

/**
 * Turns the dataset items of a finished run into stored reviews for one tenant.
 */
public interface ReviewDatasetProcessor {

    boolean supports(TargetType targetType);

    DatasetProcessingResult process(String tenantId, TargetType targetType, List<JsonNode> items, boolean initialRun);
}
