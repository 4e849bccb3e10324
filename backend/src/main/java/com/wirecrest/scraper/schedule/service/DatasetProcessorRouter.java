package com.wirecrest.scraper.schedule.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wirecrest.scraper.schedule.model.DatasetProcessingResult;
import com.wirecrest.scraper.schedule.model.TargetType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DatasetProcessorRouter {
    private final List<ReviewDatasetProcessor> processors;

    public DatasetProcessorRouter(List<ReviewDatasetProcessor> processors) {
        this.processors = processors;
    }

    public DatasetProcessingResult process(String tenantId, TargetType targetType, List<JsonNode> items, boolean initialRun) {
        if (items == null || items.isEmpty()) {
            return DatasetProcessingResult.empty();
        }
        ReviewDatasetProcessor processor = processors.stream()
            .filter(candidate -> candidate.supports(targetType))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No dataset processor for " + targetType));
        return processor.process(tenantId, targetType, items, initialRun);
    }
}
