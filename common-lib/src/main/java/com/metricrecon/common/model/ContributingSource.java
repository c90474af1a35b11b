package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One observation as it took part in a resolution, with the weight it was given.
 * Discarded entries are kept for the audit record (e.g. everything outvoted by a regulatory override).
 */
public record ContributingSource(
    @JsonProperty("sourceId")   String         sourceId,
    @JsonProperty("category")   SourceCategory category,
    @JsonProperty("value")      double         value,
    @JsonProperty("weight")     double         weight,
    @JsonProperty("observedAt") Instant        observedAt,
    @JsonProperty("discarded")  boolean        discarded
) {}
