package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.model.IngestionRecord;
import com.delta.ingestion.incremental.model.MarksResponse;
import com.delta.ingestion.incremental.model.ProviderStatus;
import com.delta.ingestion.incremental.model.ProviderStatusResponse;
import com.delta.ingestion.incremental.persistence.IngestionMarkRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class IngestionStatusService {
    static final String WAITING_TO_START = "rest complete, waiting to start";
    static final String NO_RECORDS_YET = "No records yet (provider is restarting)";

    private final IngestionStateMachine stateMachine;
    private final IngestionMarkRepository marks;

    public IngestionStatusService(IngestionStateMachine stateMachine, IngestionMarkRepository marks) {
        this.stateMachine = stateMachine;
        this.marks = marks;
    }

    public ProviderStatusResponse getProviderStatus(String provider) {
        Optional<IngestionRecord> current = stateMachine.currentOrThrow(provider);
        if (current.isEmpty()) {
            return new ProviderStatusResponse(true, new ProviderStatus(WAITING_TO_START, null), null);
        }
        IngestionRecord record = current.get();
        return new ProviderStatusResponse(
            true,
            new ProviderStatus(record.status().value(), record.nextActionAt()),
            record.lastError()
        );
    }

    public MarksResponse getMarks(String provider) {
        Optional<IngestionRecord> current = stateMachine.currentOrThrow(provider);
        if (current.isEmpty()) {
            return new MarksResponse(true, null, NO_RECORDS_YET);
        }
        return new MarksResponse(true, marks.getAll(current.get().id()), null);
    }
}
