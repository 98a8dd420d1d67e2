package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderStatus(
    @JsonProperty("current_action") String currentAction,
    @JsonProperty("next_action_at") Instant nextActionAt
) {
}
