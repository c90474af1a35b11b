package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnomalyFinding(
    @JsonProperty("type")     AnomalyType     type,
    @JsonProperty("severity") AnomalySeverity severity,
    @JsonProperty("detail")   String          detail
) {}
