package com.delta.ingestion.incremental.service;

import com.delta.ingestion.config.IngestionProperties;
import com.delta.ingestion.incremental.model.SchedulerStatusResponse;
import com.delta.ingestion.incremental.model.TickOutcome;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class IngestionSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(IngestionSchedulerService.class);

    private final IngestionStateMachine stateMachine;
    private final IncrementalProviderRegistry registry;
    private final IngestionProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private int activeWorkerCount;

    public IngestionSchedulerService(
        IngestionStateMachine stateMachine,
        IncrementalProviderRegistry registry,
        IngestionProperties properties
    ) {
        this.stateMachine = stateMachine;
        this.registry = registry;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public SchedulerStatusResponse getStatus() {
        return new SchedulerStatusResponse(running.get(), activeWorkerCount, registry.providerNames());
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getScheduler().getWorkerCount();
            int pollIntervalMs = properties.getScheduler().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("ingestion-scheduler-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Ingestion scheduler started with {} workers", workerCount);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Ingestion scheduler stopped");
        }
    }

    public int tickAll() {
        int failures = 0;
        List<String> providers = registry.providerNames();
        for (String provider : providers) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                TickOutcome outcome = stateMachine.tick(provider);
                log.debug("Tick for provider {}: {}", provider, outcome);
            } catch (Exception e) {
                failures++;
                log.warn("Scheduled tick failed for provider {}", provider, e);
            }
        }
        return failures;
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("ingestion-scheduler-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            tickAll();
            sleep(pollIntervalMs);
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
