package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Industry/peer range for a metric, supplied from outside the engine.
 */
public record BenchmarkRange(
    @JsonProperty("min") double min,
    @JsonProperty("max") double max
) {}
