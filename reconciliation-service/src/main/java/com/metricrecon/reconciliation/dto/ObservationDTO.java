package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One reading inside a {@link ResolveRequest}; the metric key is taken from the enclosing request.
 * A missing value deserialises to {@code null} and is dropped by the engine as non-finite.
 */
public record ObservationDTO(
    @JsonProperty("sourceId")   String  sourceId,
    @JsonProperty("value")      Double  value,
    @JsonProperty("observedAt") Instant observedAt
) {}
