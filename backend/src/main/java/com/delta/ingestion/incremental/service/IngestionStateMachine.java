package com.delta.ingestion.incremental.service;

import com.delta.ingestion.config.IngestionProperties;
import com.delta.ingestion.incremental.model.IngestionMark;
import com.delta.ingestion.incremental.model.IngestionRecord;
import com.delta.ingestion.incremental.model.IngestionRecordUpdate;
import com.delta.ingestion.incremental.model.IngestionStatus;
import com.delta.ingestion.incremental.model.ManualActionResult;
import com.delta.ingestion.incremental.model.TickOutcome;
import com.delta.ingestion.incremental.persistence.IngestionMarkRepository;
import com.delta.ingestion.incremental.persistence.IngestionRecordRepository;
import com.delta.ingestion.incremental.spi.IncrementalProvider;
import com.delta.ingestion.incremental.spi.IngestionContext;
import com.delta.ingestion.incremental.spi.ProviderPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives the ingestion cycle of each provider. Every transition is a conditional update on the
 * record's id, status and open ticket; a lost update is retried once against freshly read state.
 */
@Service
public class IngestionStateMachine {
    private static final Logger log = LoggerFactory.getLogger(IngestionStateMachine.class);

    public static final String NEXT_ACTION_DONE = "nothing (done)";
    public static final String NEXT_ACTION_INGEST = "ingest";
    public static final String NEXT_ACTION_REST = "rest";
    public static final String NEXT_ACTION_BACKOFF = "backoff";
    public static final String NEXT_ACTION_CANCEL = "cancel";

    private final IngestionRecordRepository records;
    private final IngestionMarkRepository marks;
    private final IncrementalProviderRegistry registry;
    private final IngestionProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final String instanceId;

    public IngestionStateMachine(
        IngestionRecordRepository records,
        IngestionMarkRepository marks,
        IncrementalProviderRegistry registry,
        IngestionProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.records = records;
        this.marks = marks;
        this.registry = registry;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.instanceId = "ingestion-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    public TickOutcome tick(String provider) {
        return withRetry(provider, "tick", () -> {
            Optional<IngestionRecord> current = records.getCurrent(provider);
            if (current.isEmpty()) {
                return startFirstCycle(provider);
            }
            return advance(current.get(), true);
        });
    }

    public ManualActionResult triggerNextAction(String provider) {
        return withRetry(provider, "trigger", () -> {
            Optional<IngestionRecord> current = currentOrThrow(provider);
            if (current.isEmpty()) {
                return ManualActionResult.NO_CURRENT_RECORD;
            }
            TickOutcome outcome = advance(current.get(), false);
            log.info("Manual trigger for provider {} finished with {}", provider, outcome);
            return ManualActionResult.APPLIED;
        });
    }

    public ManualActionResult start(String provider) {
        return withRetry(provider, "start", () -> {
            Optional<IngestionRecord> current = currentOrThrow(provider);
            if (current.isEmpty()) {
                return ManualActionResult.NO_CURRENT_RECORD;
            }
            IngestionRecord record = current.get();
            Instant now = clock.instant();
            switch (record.status()) {
                case RESTING -> transition(
                    record,
                    IngestionStatus.RESTING,
                    IngestionRecordUpdate.toStatus(IngestionStatus.COMPLETE).nextAction(NEXT_ACTION_DONE, now),
                    now
                );
                case INGESTING, CANCELING -> transition(
                    record,
                    record.status(),
                    IngestionRecordUpdate.toStatus(IngestionStatus.CANCELING).nextAction(NEXT_ACTION_CANCEL, now),
                    now
                );
                case COMPLETE, ERROR -> throw closedRecord(record);
            }
            log.info("Start requested for provider {} (was {})", provider, record.status().value());
            return ManualActionResult.APPLIED;
        });
    }

    public ManualActionResult cancel(String provider) {
        return withRetry(provider, "cancel", () -> {
            Optional<IngestionRecord> current = currentOrThrow(provider);
            if (current.isEmpty()) {
                return ManualActionResult.NO_CURRENT_RECORD;
            }
            IngestionRecord record = current.get();
            Instant now = clock.instant();
            Instant restUntil = now.plus(properties.getCancelCooldown());
            IngestionRecordUpdate update = IngestionRecordUpdate.toStatus(IngestionStatus.RESTING)
                .nextAction(NEXT_ACTION_DONE, restUntil)
                .completedAt(now)
                .releasingLease();
            if (records.updateByName(provider, record.status(), update, now) == 0) {
                throw new TransitionLostException(provider, record.status());
            }
            log.info("Canceled ingestion {} for provider {}, resting until {}", record.id(), provider, restUntil);
            return ManualActionResult.APPLIED;
        });
    }

    public Optional<IngestionRecord> currentOrThrow(String provider) {
        Optional<IngestionRecord> current = records.getCurrent(provider);
        if (current.isEmpty() && !isKnownProvider(provider)) {
            throw new ProviderNotFoundException(provider);
        }
        return current;
    }

    public boolean isKnownProvider(String provider) {
        return registry.contains(provider) || records.hasHistory(provider);
    }

    private TickOutcome startFirstCycle(String provider) {
        if (!isKnownProvider(provider)) {
            throw new ProviderNotFoundException(provider);
        }
        if (!registry.contains(provider)) {
            log.warn("Provider {} has ingestion history but no registered implementation", provider);
            return TickOutcome.PROVIDER_UNAVAILABLE;
        }
        Instant now = clock.instant();
        Optional<Instant> latest = records.findLatestNextActionAt(provider);
        if (latest.isPresent() && latest.get().isAfter(now)) {
            return TickOutcome.WAITING;
        }
        IngestionRecord created = records.insert(
            provider,
            IngestionStatus.INGESTING,
            NEXT_ACTION_INGEST,
            now,
            null,
            now
        );
        log.info("Opened ingestion {} for provider {}", created.id(), provider);
        return TickOutcome.CYCLE_STARTED;
    }

    private TickOutcome advance(IngestionRecord record, boolean scheduled) {
        Instant now = clock.instant();
        return switch (record.status()) {
            case RESTING -> record.isDue(now) ? finishResting(record, now) : TickOutcome.WAITING;
            case INGESTING -> scheduled && !record.isDue(now) ? TickOutcome.WAITING : runBurst(record, scheduled);
            case CANCELING -> finishCanceling(record, now, null);
            case COMPLETE, ERROR -> throw closedRecord(record);
        };
    }

    private TickOutcome finishResting(IngestionRecord record, Instant now) {
        String provider = record.providerName();
        if (!registry.contains(provider)) {
            log.warn("Provider {} is due but has no registered implementation", provider);
            return TickOutcome.PROVIDER_UNAVAILABLE;
        }
        IngestionRecord created = transactionTemplate.execute(status -> {
            transition(
                record,
                IngestionStatus.RESTING,
                IngestionRecordUpdate.toStatus(IngestionStatus.COMPLETE).nextAction(NEXT_ACTION_DONE, now),
                now
            );
            return records.insert(provider, IngestionStatus.INGESTING, NEXT_ACTION_INGEST, now, null, now);
        });
        log.info("Provider {} finished resting, opened ingestion {}", provider, created == null ? null : created.id());
        return TickOutcome.CYCLE_STARTED;
    }

    private TickOutcome finishCanceling(IngestionRecord record, Instant now, String leaseOwner) {
        Instant restUntil = now.plus(properties.getRestLength());
        transition(
            record,
            IngestionStatus.CANCELING,
            leaseOwner,
            IngestionRecordUpdate.toStatus(IngestionStatus.RESTING)
                .nextAction(NEXT_ACTION_REST, restUntil)
                .completedAt(now)
                .releasingLease(),
            now
        );
        log.info("Ingestion {} for provider {} canceled, resting until {}", record.id(), record.providerName(), restUntil);
        return TickOutcome.CANCELED;
    }

    private TickOutcome runBurst(IngestionRecord record, boolean scheduled) {
        Optional<IncrementalProvider> provider = registry.find(record.providerName());
        if (provider.isEmpty()) {
            log.warn("Provider {} is ingesting but has no registered implementation", record.providerName());
            return TickOutcome.PROVIDER_UNAVAILABLE;
        }
        Instant now = clock.instant();
        String owner = instanceId + ":" + UUID.randomUUID();
        Instant leaseUntil = now.plusSeconds(properties.getLeaseSeconds());
        if (!records.claimLease(record.id(), owner, now, leaseUntil, scheduled)) {
            log.debug("Ingestion {} for provider {} is busy or not due", record.id(), record.providerName());
            return TickOutcome.BUSY;
        }
        try {
            return executeBurst(record, provider.get(), owner);
        } catch (LeaseLostException e) {
            log.info("Ingestion {} for provider {} stopped burst: {}", record.id(), record.providerName(), e.getMessage());
            return TickOutcome.INTERRUPTED;
        } catch (RuntimeException e) {
            releaseLease(record, owner);
            throw e;
        }
    }

    private TickOutcome executeBurst(IngestionRecord record, IncrementalProvider provider, String owner) {
        Instant deadline = clock.instant().plusSeconds(properties.getBurstLengthSeconds());
        String cursor = marks.getLast(record.id()).map(IngestionMark::cursor).orElse(null);
        boolean progressed = false;
        while (true) {
            IngestionRecord latest = records.findRecord(record.id())
                .orElseThrow(() -> new TransitionLostException(record.providerName(), IngestionStatus.INGESTING));
            if (!latest.isCurrent() || latest.status() != IngestionStatus.INGESTING) {
                if (latest.isCurrent() && latest.status() == IngestionStatus.CANCELING) {
                    return finishCanceling(latest, clock.instant(), owner);
                }
                log.info(
                    "Ingestion {} for provider {} left ingesting ({}), stopping burst",
                    latest.id(),
                    latest.providerName(),
                    latest.status().value()
                );
                return TickOutcome.INTERRUPTED;
            }
            Instant stepStart = clock.instant();
            if (!records.renewLease(latest.id(), owner, stepStart, stepStart.plusSeconds(properties.getLeaseSeconds()))) {
                throw new LeaseLostException(latest);
            }

            ProviderPage page;
            try {
                page = provider.next(new IngestionContext(latest.providerName(), latest.id(), cursor));
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return recordFailure(latest, owner, e, progressed ? 0 : latest.attempts());
            }
            if (page == null) {
                return recordFailure(
                    latest,
                    owner,
                    new IllegalStateException("Provider returned no page"),
                    progressed ? 0 : latest.attempts()
                );
            }
            progressed = true;
            if (page.cursor() != null) {
                IngestionMark mark = marks.append(latest.id(), owner, page.cursor(), clock.instant())
                    .orElseThrow(() -> new LeaseLostException(latest));
                cursor = mark.cursor();
            }

            Instant now = clock.instant();
            if (page.done()) {
                return completeCycle(latest, owner, now);
            }
            if (!now.isBefore(deadline)) {
                return pause(latest, owner, now);
            }
        }
    }

    private TickOutcome completeCycle(IngestionRecord record, String owner, Instant now) {
        Instant restUntil = now.plus(properties.getRestLength());
        transition(
            record,
            IngestionStatus.INGESTING,
            owner,
            IngestionRecordUpdate.toStatus(IngestionStatus.COMPLETE)
                .nextAction(NEXT_ACTION_REST, restUntil)
                .completedAt(now)
                .attempts(0)
                .releasingLease(),
            now
        );
        log.info("Ingestion {} for provider {} complete, next cycle at {}", record.id(), record.providerName(), restUntil);
        return TickOutcome.COMPLETED;
    }

    private TickOutcome pause(IngestionRecord record, String owner, Instant now) {
        Instant resumeAt = now.plusSeconds(properties.getBurstIntervalSeconds());
        transition(
            record,
            IngestionStatus.INGESTING,
            owner,
            IngestionRecordUpdate.toStatus(IngestionStatus.INGESTING)
                .nextAction(NEXT_ACTION_INGEST, resumeAt)
                .attempts(0)
                .releasingLease(),
            now
        );
        log.debug("Ingestion {} for provider {} paused until {}", record.id(), record.providerName(), resumeAt);
        return TickOutcome.PAUSED;
    }

    private TickOutcome recordFailure(IngestionRecord record, String owner, Exception error, int failuresSoFar) {
        Instant now = clock.instant();
        int attempts = Math.max(0, failuresSoFar) + 1;
        String message = describe(error);
        List<Integer> backoff = properties.getBackoffMinutes();
        if (attempts <= backoff.size()) {
            Instant retryAt = now.plus(Duration.ofMinutes(backoff.get(attempts - 1)));
            transition(
                record,
                IngestionStatus.INGESTING,
                owner,
                IngestionRecordUpdate.toStatus(IngestionStatus.INGESTING)
                    .nextAction(NEXT_ACTION_BACKOFF, retryAt)
                    .failure(message, attempts)
                    .releasingLease(),
                now
            );
            log.warn(
                "Ingestion step failed for provider {} (attempt {}), retrying at {}: {}",
                record.providerName(),
                attempts,
                retryAt,
                message
            );
            return TickOutcome.BACKING_OFF;
        }

        Instant restUntil = now.plus(properties.getRestLength());
        transition(
            record,
            IngestionStatus.INGESTING,
            owner,
            IngestionRecordUpdate.toStatus(IngestionStatus.ERROR)
                .nextAction(NEXT_ACTION_REST, restUntil)
                .completedAt(now)
                .failure(message, attempts)
                .releasingLease(),
            now
        );
        log.warn(
            "Ingestion {} for provider {} failed after {} attempts, next cycle at {}",
            record.id(),
            record.providerName(),
            attempts,
            restUntil,
            error
        );
        return TickOutcome.FAILED;
    }

    private void transition(IngestionRecord record, IngestionStatus expected, IngestionRecordUpdate update, Instant now) {
        transition(record, expected, null, update, now);
    }

    private void transition(
        IngestionRecord record,
        IngestionStatus expected,
        String leaseOwner,
        IngestionRecordUpdate update,
        Instant now
    ) {
        if (records.compareAndSet(record.id(), expected, leaseOwner, update, now)) {
            return;
        }
        if (leaseOwner != null) {
            throw new LeaseLostException(record);
        }
        throw new TransitionLostException(record.providerName(), expected);
    }

    private void releaseLease(IngestionRecord record, String owner) {
        try {
            records.releaseLease(record.id(), owner, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to release lease on ingestion {} for provider {}", record.id(), record.providerName(), e);
        }
    }

    private <T> T withRetry(String provider, String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransitionLostException | DuplicateKeyException e) {
            log.info("Lost {} race for provider {}, re-reading state: {}", operation, provider, e.getMessage());
        }
        try {
            return action.get();
        } catch (TransitionLostException | DuplicateKeyException e) {
            throw new ConcurrentTransitionException(
                "Concurrent " + operation + " for provider '" + provider + "', please retry",
                e
            );
        }
    }

    private static IllegalStateException closedRecord(IngestionRecord record) {
        return new IllegalStateException(
            "Closed ingestion " + record.id() + " for provider " + record.providerName() + " is marked current"
        );
    }

    private static String describe(Exception error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return error.getClass().getSimpleName() + ": " + message;
    }

    // The burst no longer owns the cycle: its lease was taken over or the record moved on.
    private static final class LeaseLostException extends RuntimeException {
        private LeaseLostException(IngestionRecord record) {
            super("lease on ingestion " + record.id() + " is no longer held");
        }
    }

    private static final class TransitionLostException extends RuntimeException {
        private TransitionLostException(String provider, IngestionStatus expected) {
            super("Ingestion record for provider " + provider + " is no longer " + expected.value());
        }
    }
}
