package com.delta.ingestion.incremental.model;

import java.util.List;

public record SchedulerStatusResponse(boolean running, int workerCount, List<String> providers) {
}
