package com.survivaladvisor.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Body of {@code POST /ask}. {@code snapshot} is the raw player state, normalized
 * server-side; {@code lastAiRequestAt} comes from the caller's own request history.
 */
public record AskRequest(
    @JsonProperty("question") String question,
    @JsonProperty("snapshot") JsonNode snapshot,
    @JsonProperty("forceAi") boolean forceAi,
    @JsonProperty("lastAiRequestAt") Instant lastAiRequestAt
) {}
