package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.model.CleanupResult;
import com.delta.ingestion.incremental.model.IngestionRecord;
import com.delta.ingestion.incremental.model.IngestionStatus;
import com.delta.ingestion.incremental.model.PurgeResult;
import com.delta.ingestion.incremental.persistence.IngestionMarkRepository;
import com.delta.ingestion.incremental.persistence.IngestionRecordRepository;
import com.delta.ingestion.incremental.support.IngestionTestConfig;
import com.delta.ingestion.incremental.support.MutableClock;
import com.delta.ingestion.incremental.support.ScriptedProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.delta.ingestion.incremental.support.IngestionTestConfig.PAGER;
import static com.delta.ingestion.incremental.support.IngestionTestConfig.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Import(IngestionTestConfig.class)
class IngestionCleanupServiceTest {

    @Autowired
    private IngestionCleanupService cleanupService;

    @Autowired
    private IngestionStateMachine stateMachine;

    @Autowired
    private IngestionRecordRepository records;

    @Autowired
    private IngestionMarkRepository marks;

    @Autowired
    private ScriptedProvider pager;

    @Autowired
    private MutableClock clock;

    private String restingLegacy;

    @BeforeEach
    void setUp() {
        records.deleteByProvider(PAGER);
        pager.reset(10);
        pager.stepDuration(Duration.ofSeconds(1));
        clock.set(START);
        restingLegacy = "legacy-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @AfterEach
    void tearDown() {
        records.deleteByProvider(restingLegacy);
    }

    @Test
    void purgeTwiceEndsInSameRestingState() {
        stateMachine.tick(PAGER);
        stateMachine.tick(PAGER);
        assertEquals(3L, marks.countByProvider(PAGER));
        Instant purgeAt = clock.instant();

        PurgeResult first = cleanupService.purgeAndResetProvider(PAGER);
        assertTrue(first.success());
        assertEquals(1, first.recordsDeleted());
        assertEquals(3, first.marksDeleted());
        assertEquals(purgeAt.plus(Duration.ofHours(24)), first.nextActionAt());

        PurgeResult second = cleanupService.purgeAndResetProvider(PAGER);
        assertEquals(1, second.recordsDeleted());
        assertEquals(0, second.marksDeleted());

        List<IngestionRecord> remaining = records.findByProvider(PAGER);
        assertThat(remaining).hasSize(1);
        IngestionRecord resting = remaining.get(0);
        assertEquals(IngestionStatus.RESTING, resting.status());
        assertEquals(purgeAt.plus(Duration.ofHours(24)), resting.nextActionAt());
        assertEquals(0L, marks.countByProvider(PAGER));
    }

    @Test
    void purgeOfUnknownProviderIsRejected() {
        String unknown = "unknown-" + UUID.randomUUID().toString().substring(0, 8);

        assertThrows(ProviderNotFoundException.class, () -> cleanupService.purgeAndResetProvider(unknown));
        assertThat(records.findByProvider(unknown)).isEmpty();
    }

    @Test
    void cleanupRestsEveryProviderNotAlreadyResting() {
        records.insert(restingLegacy, IngestionStatus.RESTING, "nothing (done)", START.plusSeconds(600), START, START);
        stateMachine.tick(PAGER);

        CleanupResult result = cleanupService.cleanupProviders();

        assertTrue(result.success());
        assertThat(result.providers()).contains(PAGER).doesNotContain(restingLegacy);
        assertThat(result.recordsRested()).isEqualTo(result.providers().size());
        IngestionRecord pagerRecord = records.getCurrent(PAGER).orElseThrow();
        assertEquals(IngestionStatus.RESTING, pagerRecord.status());
        assertEquals(START.plus(Duration.ofHours(24)), pagerRecord.nextActionAt());
        assertEquals(START.plusSeconds(600), records.getCurrent(restingLegacy).orElseThrow().nextActionAt());
    }

    @Test
    void clearFinishedKeepsMarksOfCurrentCycle() {
        pager.reset(3);
        stateMachine.tick(PAGER);
        stateMachine.tick(PAGER);
        clock.advance(Duration.ofMinutes(1440));
        stateMachine.tick(PAGER);
        pager.reset(10);
        pager.stepDuration(Duration.ofSeconds(1));
        stateMachine.tick(PAGER);
        assertEquals(6L, marks.countByProvider(PAGER));

        assertEquals(3, cleanupService.clearFinishedIngestions(PAGER));
        assertEquals(0, cleanupService.clearFinishedIngestions(PAGER));
        IngestionRecord current = records.getCurrent(PAGER).orElseThrow();
        assertThat(marks.getAll(current.id())).hasSize(3);
    }
}
