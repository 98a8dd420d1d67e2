package com.delta.ingestion.incremental.api;

import com.delta.ingestion.incremental.model.SchedulerStatusResponse;
import com.delta.ingestion.incremental.service.IngestionSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/incremental/scheduler")
public class SchedulerController {
    private final IngestionSchedulerService schedulerService;

    public SchedulerController(IngestionSchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        schedulerService.start();
        return schedulerService.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        schedulerService.stop();
        return schedulerService.getStatus();
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return schedulerService.getStatus();
    }
}
