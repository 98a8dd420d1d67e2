package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.model.HealthResponse;
import com.delta.ingestion.incremental.persistence.IngestionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class IngestionHealthService {
    private static final Logger log = LoggerFactory.getLogger(IngestionHealthService.class);

    private final IngestionRecordRepository records;

    public IngestionHealthService(IngestionRecordRepository records) {
        this.records = records;
    }

    public HealthResponse check() {
        List<String> duplicates = records.findDuplicateOpenProviders();
        if (duplicates.isEmpty()) {
            return HealthResponse.ok();
        }
        log.warn("Consistency violation: providers with more than one open ingestion: {}", duplicates);
        return HealthResponse.duplicates(duplicates);
    }
}
