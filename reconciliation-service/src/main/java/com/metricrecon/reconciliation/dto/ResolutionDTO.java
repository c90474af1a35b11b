package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricrecon.common.model.ResolvedMetric;
import com.metricrecon.common.model.ReviewTask;

/**
 * Outcome of one resolution as returned over HTTP.
 *
 * recordId   — id of the persisted {@code resolved_metrics} row
 * reviewTask — null when no human review was required
 */
public record ResolutionDTO(
    @JsonProperty("recordId")   Long           recordId,
    @JsonProperty("metric")     ResolvedMetric metric,
    @JsonProperty("reviewTask") ReviewTask     reviewTask
) {}
