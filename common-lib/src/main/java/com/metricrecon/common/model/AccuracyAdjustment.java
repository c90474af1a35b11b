package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry in a source's append-only accuracy log.
 * {@code newAccuracy} is always derived from {@code previousAccuracy} and {@code requestedDelta},
 * clamped to [0.0, 1.0].
 */
public record AccuracyAdjustment(
    @JsonProperty("sourceId")         String  sourceId,
    @JsonProperty("previousAccuracy") double  previousAccuracy,
    @JsonProperty("newAccuracy")      double  newAccuracy,
    @JsonProperty("requestedDelta")   double  requestedDelta,
    @JsonProperty("reason")           String  reason,
    @JsonProperty("adjustedAt")       Instant adjustedAt
) {}
