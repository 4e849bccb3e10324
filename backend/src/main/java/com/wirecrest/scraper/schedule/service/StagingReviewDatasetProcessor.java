package com.wirecrest.scraper.schedule.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wirecrest.scraper.schedule.model.DatasetProcessingResult;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.JobRunJdbcRepository;
import com.wirecrest.scraper.schedule.util.ItemKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stores raw items in the staging table, skipping ones already stored for the tenant. Review
 * normalization and sentiment analysis run downstream of this table.
 */
@Component
public class StagingReviewDatasetProcessor implements ReviewDatasetProcessor {
    private static final Logger log = LoggerFactory.getLogger(StagingReviewDatasetProcessor.class);

    private final JobRunJdbcRepository repository;
    private final Clock clock;

    public StagingReviewDatasetProcessor(JobRunJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public boolean supports(TargetType targetType) {
        return true;
    }

    @Override
    public DatasetProcessingResult process(String tenantId, TargetType targetType, List<JsonNode> items, boolean initialRun) {
        Instant fetchedAt = clock.instant();
        int inserted = 0;
        int duplicates = 0;
        Set<String> updatedTargets = new HashSet<>();
        for (JsonNode item : items) {
            String identifier = targetType.extractIdentifier(item);
            String key = ItemKeys.itemKey(targetType, identifier, item);
            if (repository.insertReviewItem(tenantId, targetType, identifier, key, item.toString(), fetchedAt)) {
                inserted++;
                if (identifier != null) {
                    updatedTargets.add(identifier);
                }
            } else {
                duplicates++;
            }
        }
        log.info("Staged {} new / {} duplicate {} items for tenant {}{}",
            inserted, duplicates, targetType, tenantId, initialRun ? " (initial run)" : "");
        return new DatasetProcessingResult(items.size(), inserted, duplicates, updatedTargets.size());
    }
}
