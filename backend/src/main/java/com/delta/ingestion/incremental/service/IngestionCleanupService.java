package com.delta.ingestion.incremental.service;

import com.delta.ingestion.config.IngestionProperties;
import com.delta.ingestion.incremental.model.CleanupResult;
import com.delta.ingestion.incremental.model.IngestionRecord;
import com.delta.ingestion.incremental.model.IngestionStatus;
import com.delta.ingestion.incremental.model.ManualActionResult;
import com.delta.ingestion.incremental.model.PurgeResult;
import com.delta.ingestion.incremental.persistence.IngestionMarkRepository;
import com.delta.ingestion.incremental.persistence.IngestionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class IngestionCleanupService {
    private static final Logger log = LoggerFactory.getLogger(IngestionCleanupService.class);

    private final IngestionRecordRepository records;
    private final IngestionMarkRepository marks;
    private final IngestionStateMachine stateMachine;
    private final IngestionProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IngestionCleanupService(
        IngestionRecordRepository records,
        IngestionMarkRepository marks,
        IngestionStateMachine stateMachine,
        IngestionProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.records = records;
        this.marks = marks;
        this.stateMachine = stateMachine;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public CleanupResult cleanupProviders() {
        Set<String> candidates = new LinkedHashSet<>();
        for (IngestionRecord record : records.healthcheck()) {
            if (record.status() != IngestionStatus.RESTING) {
                candidates.add(record.providerName());
            }
        }

        List<String> rested = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String provider : candidates) {
            try {
                if (stateMachine.cancel(provider) == ManualActionResult.APPLIED) {
                    rested.add(provider);
                }
            } catch (RuntimeException e) {
                failed.add(provider);
                log.warn("Cleanup failed to rest provider {}", provider, e);
            }
        }
        log.info("Ingestion cleanup rested {} providers, {} failed", rested.size(), failed.size());
        return new CleanupResult(failed.isEmpty(), rested, rested.size(), failed);
    }

    public PurgeResult purgeAndResetProvider(String provider) {
        if (!stateMachine.isKnownProvider(provider)) {
            throw new ProviderNotFoundException(provider);
        }
        Instant now = clock.instant();
        Instant restUntil = now.plus(properties.getCancelCooldown());
        PurgeResult result = transactionTemplate.execute(status -> {
            int marksDeleted = marks.deleteByProvider(provider);
            int recordsDeleted = records.deleteByProvider(provider);
            records.insert(
                provider,
                IngestionStatus.RESTING,
                IngestionStateMachine.NEXT_ACTION_DONE,
                restUntil,
                now,
                now
            );
            return new PurgeResult(true, provider, recordsDeleted, marksDeleted, restUntil);
        });
        log.info(
            "Purged provider {}: records={}, marks={}, resting until {}",
            provider,
            result == null ? 0 : result.recordsDeleted(),
            result == null ? 0 : result.marksDeleted(),
            restUntil
        );
        return result;
    }

    public int clearFinishedIngestions(String provider) {
        if (!stateMachine.isKnownProvider(provider)) {
            throw new ProviderNotFoundException(provider);
        }
        Instant threshold = clock.instant().minus(Duration.ofMinutes(properties.getMarkRetentionMinutes()));
        int deleted = marks.clearFinished(provider, threshold);
        log.info("Removed {} expired marks for provider {}", deleted, provider);
        return deleted;
    }
}
