package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.schedule.model.BatchGroupStats;
import com.wirecrest.scraper.schedule.model.ConsolidationResult;
import com.wirecrest.scraper.schedule.model.HealthLevel;
import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.RebalanceResult;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.ScheduleHealthReport;
import com.wirecrest.scraper.schedule.model.SplitResult;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository;
import com.wirecrest.scraper.schedule.platform.FakeJobPlatformClient;
import com.wirecrest.scraper.schedule.platform.FakeJobPlatformConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(FakeJobPlatformConfig.class)
class BatchCapacityManagerTest {
    private static final TargetType TYPE = TargetType.GOOGLE;
    private static final JobKind KIND = JobKind.REVIEWS;
    private static final int INTERVAL = 24;

    @Autowired
    private BatchCapacityManager capacityManager;

    @Autowired
    private IntervalScheduleRegistry registry;

    @Autowired
    private ScheduleJdbcRepository repository;

    @Autowired
    private FakeJobPlatformClient platform;

    private int identifierSequence;

    @BeforeEach
    void setUp() {
        platform.reset();
        identifierSequence = 0;
    }

    @Test
    void splitMovesNewerHalfIntoNextBatch() {
        ScheduleEntry source = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(source, 3);

        SplitResult result = capacityManager.split(source.id());

        assertThat(result.split()).isTrue();
        assertThat(result.movedSubscribers()).isEqualTo(2);
        assertThat(registry.requireEntry(source.id()).subscriberCount()).isEqualTo(1);
        ScheduleEntry created = registry.requireEntry(result.newEntryId());
        assertThat(created.batchIndex()).isEqualTo(1);
        assertThat(created.subscriberCount()).isEqualTo(2);
        assertThat(registry.subscribers(source.id())).extracting(m -> m.externalIdentifier()).containsExactly("place-1");
    }

    @Test
    void splitLeavesSingleSubscriberEntryAlone() {
        ScheduleEntry source = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(source, 1);

        SplitResult result = capacityManager.split(source.id());

        assertThat(result.split()).isFalse();
        assertThat(registry.listEntries(TYPE, KIND, INTERVAL)).hasSize(1);
    }

    @Test
    void rebalanceSpreadsSubscribersAcrossBatches() {
        ScheduleEntry first = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry second = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry third = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(first, 3);
        seed(second, 1);

        RebalanceResult result = capacityManager.rebalance(TYPE, KIND, INTERVAL);

        assertThat(result.success()).isTrue();
        assertThat(result.batches()).isEqualTo(3);
        assertThat(result.movedSubscribers()).isEqualTo(1);
        assertThat(counts()).containsExactly(2, 2, 0);
        assertThat(registry.requireEntry(third.id()).active()).isFalse();
    }

    @Test
    void rebalanceRefusesWhenBatchesCannotHoldTheGroup() {
        ScheduleEntry first = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry second = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(first, 5);
        seed(second, 2);

        RebalanceResult result = capacityManager.rebalance(TYPE, KIND, INTERVAL);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("exceeds capacity");
        assertThat(counts()).containsExactly(5, 2);
    }

    @Test
    void consolidateMergesUnderFilledBatchAndDeletesIt() {
        ScheduleEntry first = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry second = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry third = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(first, 1);
        seed(second, 1);
        seed(third, 3);

        ConsolidationResult result = capacityManager.consolidate(TYPE, KIND, INTERVAL, 0.7);

        assertThat(result.success()).isTrue();
        assertThat(result.batchesRemoved()).isEqualTo(1);
        assertThat(result.movedSubscribers()).isEqualTo(1);
        assertThat(repository.findEntry(first.id())).isEmpty();
        assertThat(platform.deletedJobs()).contains(first.externalJobId());
        assertThat(registry.requireEntry(second.id()).subscriberCount()).isEqualTo(2);
        assertThat(registry.requireEntry(third.id()).subscriberCount()).isEqualTo(3);
    }

    @Test
    void consolidateWithDefaultThresholdKeepsNonEmptyBatches() {
        ScheduleEntry first = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry second = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(first, 1);
        seed(second, 1);

        ConsolidationResult result = capacityManager.consolidate(TYPE, KIND, INTERVAL);

        assertThat(result.batchesRemoved()).isZero();
        assertThat(counts()).containsExactly(1, 1);
    }

    @Test
    void healthReportFlagsFullBatches() {
        ScheduleEntry full = registry.createBatch(TYPE, KIND, INTERVAL);
        registry.createBatch(TYPE, KIND, INTERVAL);
        seed(full, 3);

        ScheduleHealthReport report = capacityManager.healthStatus();

        assertThat(report.critical()).isEqualTo(1);
        assertThat(report.healthy()).isEqualTo(1);
        assertThat(report.details()).singleElement().satisfies(detail -> {
            assertThat(detail.entryId()).isEqualTo(full.id());
            assertThat(detail.level()).isEqualTo(HealthLevel.CRITICAL);
        });
    }

    @Test
    void groupStatsReportSpread() {
        ScheduleEntry first = registry.createBatch(TYPE, KIND, INTERVAL);
        ScheduleEntry second = registry.createBatch(TYPE, KIND, INTERVAL);
        seed(first, 3);
        seed(second, 1);

        BatchGroupStats stats = capacityManager.groupStats(TYPE, KIND, INTERVAL);

        assertThat(stats.batches()).isEqualTo(2);
        assertThat(stats.totalSubscribers()).isEqualTo(4);
        assertThat(stats.averageBatchSize()).isEqualTo(2.0);
        assertThat(stats.needsRebalancing()).isTrue();
        assertThat(stats.batchSizes()).containsExactly(3, 1);
    }

    private void seed(ScheduleEntry entry, int subscribers) {
        for (int i = 0; i < subscribers; i++) {
            identifierSequence++;
            repository.insertMapping(
                UUID.randomUUID().toString(),
                "team-seed",
                TYPE,
                KIND,
                entry.id(),
                "place-" + identifierSequence,
                INTERVAL
            );
        }
        registry.rebuildInput(entry.id());
    }

    private List<Integer> counts() {
        return registry.listEntries(TYPE, KIND, INTERVAL).stream().map(ScheduleEntry::subscriberCount).toList();
    }
}
