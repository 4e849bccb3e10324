package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.JobRunKind;
import com.wirecrest.scraper.schedule.model.JobRunStatus;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.JobRunJdbcRepository;
import com.wirecrest.scraper.schedule.platform.ActorInputFactory;
import com.wirecrest.scraper.schedule.platform.JobPlatformClient;
import com.wirecrest.scraper.schedule.platform.PlatformRun;
import com.wirecrest.scraper.schedule.platform.WebhookSecurity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Launches the one-off full-history scrape a tenant gets when it starts tracking targets. The run record
 * carries the tenant so the completion callback can attribute the results directly.
 */
@Service
public class InitialRunService {
    private static final Logger log = LoggerFactory.getLogger(InitialRunService.class);

    private final JobPlatformClient platformClient;
    private final ActorInputFactory inputFactory;
    private final WebhookSecurity webhookSecurity;
    private final JobRunJdbcRepository jobRunRepository;
    private final SchedulerProperties properties;
    private final Clock clock;

    public InitialRunService(
        JobPlatformClient platformClient,
        ActorInputFactory inputFactory,
        WebhookSecurity webhookSecurity,
        JobRunJdbcRepository jobRunRepository,
        SchedulerProperties properties,
        Clock clock
    ) {
        this.platformClient = platformClient;
        this.inputFactory = inputFactory;
        this.webhookSecurity = webhookSecurity;
        this.jobRunRepository = jobRunRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public PlatformRun launch(String tenantId, TargetType targetType, List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            throw new IllegalArgumentException("No identifiers to scrape for " + targetType);
        }
        PlatformRun run = platformClient.startRun(
            targetType.actorId(),
            inputFactory.build(targetType, identifiers, properties.getInitialRun().getMaxItems()),
            webhookSecurity.webhooksFor(targetType, null)
        );
        jobRunRepository.insertRun(
            tenantId,
            targetType,
            JobRunKind.INITIAL,
            null,
            run.id(),
            run.datasetId(),
            JobRunStatus.RUNNING,
            run.startedAt() == null ? clock.instant() : run.startedAt()
        );
        log.info("Started initial {} run {} for tenant {} ({} targets)", targetType, run.id(), tenantId, identifiers.size());
        return run;
    }
}
