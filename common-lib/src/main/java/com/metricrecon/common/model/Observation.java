package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One raw reading of a metric as captured by an ingestion connector.
 * No logic — pure model.
 */
public record Observation(
    @JsonProperty("metricName") String  metricName,
    @JsonProperty("entityId")   String  entityId,
    @JsonProperty("period")     String  period,
    @JsonProperty("value")      double  value,
    @JsonProperty("sourceId")   String  sourceId,
    @JsonProperty("observedAt") Instant observedAt
) {

    @JsonIgnore
    public MetricKey key() {
        return new MetricKey(metricName, entityId, period);
    }
}
