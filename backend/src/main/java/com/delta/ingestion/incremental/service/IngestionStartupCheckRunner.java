package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.model.HealthResponse;
import com.delta.ingestion.incremental.persistence.IngestionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class IngestionStartupCheckRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestionStartupCheckRunner.class);

    private final IngestionRecordRepository records;
    private final IngestionHealthService healthService;

    public IngestionStartupCheckRunner(IngestionRecordRepository records, IngestionHealthService healthService) {
        this.records = records;
        this.healthService = healthService;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = records.isDbReachable();
        } catch (Exception e) {
            log.warn("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping ingestion consistency check because database is unreachable");
            return;
        }

        HealthResponse health = healthService.check();
        if (health.healthy()) {
            log.info("Ingestion records consistent at startup");
        } else {
            log.warn("Ingestion records inconsistent at startup, duplicated providers: {}", health.duplicateIngestions());
        }
    }
}
