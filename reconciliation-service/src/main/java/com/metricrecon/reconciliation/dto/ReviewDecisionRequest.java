package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricrecon.common.model.ReviewDecision;

public record ReviewDecisionRequest(
    @JsonProperty("decision")       ReviewDecision decision,
    @JsonProperty("notes")          String         notes,
    @JsonProperty("correctedValue") Double         correctedValue
) {}
