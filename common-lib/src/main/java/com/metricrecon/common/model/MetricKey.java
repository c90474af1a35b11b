package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity of one independent unit of resolution work.
 */
public record MetricKey(
    @JsonProperty("metricName") String metricName,
    @JsonProperty("entityId")   String entityId,
    @JsonProperty("period")     String period
) {

    public MetricKey {
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(period, "period");
    }

    @Override
    public String toString() {
        return entityId + "/" + metricName + "/" + period;
    }
}
