package com.delta.ingestion.incremental.api;

import com.delta.ingestion.incremental.model.ActionResponse;
import com.delta.ingestion.incremental.model.CleanupResult;
import com.delta.ingestion.incremental.model.DeltaResponse;
import com.delta.ingestion.incremental.model.HealthResponse;
import com.delta.ingestion.incremental.model.ManualActionResult;
import com.delta.ingestion.incremental.model.MarkDeletionResponse;
import com.delta.ingestion.incremental.model.MarksResponse;
import com.delta.ingestion.incremental.model.ProviderStatusResponse;
import com.delta.ingestion.incremental.model.PurgeResult;
import com.delta.ingestion.incremental.service.DeltaPublishService;
import com.delta.ingestion.incremental.service.IngestionCleanupService;
import com.delta.ingestion.incremental.service.IngestionHealthService;
import com.delta.ingestion.incremental.service.IngestionStateMachine;
import com.delta.ingestion.incremental.service.IngestionStatusService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/incremental")
public class IngestionAdminController {
    private final IngestionStateMachine stateMachine;
    private final IngestionStatusService statusService;
    private final IngestionHealthService healthService;
    private final IngestionCleanupService cleanupService;
    private final DeltaPublishService deltaPublishService;

    public IngestionAdminController(
        IngestionStateMachine stateMachine,
        IngestionStatusService statusService,
        IngestionHealthService healthService,
        IngestionCleanupService cleanupService,
        DeltaPublishService deltaPublishService
    ) {
        this.stateMachine = stateMachine;
        this.statusService = statusService;
        this.healthService = healthService;
        this.cleanupService = cleanupService;
        this.deltaPublishService = deltaPublishService;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthService.check();
    }

    @PostMapping("/cleanup")
    public CleanupResult cleanup() {
        return cleanupService.cleanupProviders();
    }

    @GetMapping("/providers/{provider}")
    public ProviderStatusResponse status(@PathVariable("provider") String provider) {
        return statusService.getProviderStatus(provider);
    }

    @PostMapping("/providers/{provider}/trigger")
    public ActionResponse trigger(@PathVariable("provider") String provider) {
        if (stateMachine.triggerNextAction(provider) == ManualActionResult.APPLIED) {
            return new ActionResponse(true, provider + ": Next action triggered.");
        }
        return new ActionResponse(true, "Unable to trigger next action (provider is restarting)");
    }

    @PostMapping("/providers/{provider}/start")
    public ActionResponse start(@PathVariable("provider") String provider) {
        if (stateMachine.start(provider) == ManualActionResult.APPLIED) {
            return new ActionResponse(true, provider + ": Next cycle triggered.");
        }
        return new ActionResponse(true, "Provider is already restarting");
    }

    @PostMapping("/providers/{provider}/cancel")
    public ActionResponse cancel(@PathVariable("provider") String provider) {
        if (stateMachine.cancel(provider) == ManualActionResult.APPLIED) {
            return new ActionResponse(true, provider + ": Current ingestion canceled.");
        }
        return new ActionResponse(true, "Provider is currently restarting, please wait.");
    }

    @DeleteMapping("/providers/{provider}")
    public PurgeResult purge(@PathVariable("provider") String provider) {
        return cleanupService.purgeAndResetProvider(provider);
    }

    @GetMapping("/providers/{provider}/marks")
    public MarksResponse marks(@PathVariable("provider") String provider) {
        return statusService.getMarks(provider);
    }

    @DeleteMapping("/providers/{provider}/marks")
    public MarkDeletionResponse clearMarks(@PathVariable("provider") String provider) {
        int deletions = cleanupService.clearFinishedIngestions(provider);
        return new MarkDeletionResponse(true, "Expired marks for provider '" + provider + "' removed.", deletions);
    }

    @PostMapping("/providers/{provider}/delta")
    public DeltaResponse delta(
        @PathVariable("provider") String provider,
        @RequestBody(required = false) JsonNode payload
    ) {
        deltaPublishService.publish(provider, payload == null ? NullNode.getInstance() : payload);
        return new DeltaResponse(true, provider, "Payload submitted.");
    }
}
