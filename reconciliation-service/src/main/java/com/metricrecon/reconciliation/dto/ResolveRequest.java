package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricrecon.common.model.MetricKey;
import com.metricrecon.common.model.Observation;

import java.util.List;

public record ResolveRequest(
    @JsonProperty("metricName")   String               metricName,
    @JsonProperty("entityId")     String               entityId,
    @JsonProperty("period")       String               period,
    @JsonProperty("observations") List<ObservationDTO> observations
) {

    /**
     * @throws IllegalArgumentException when a key component is missing or blank
     */
    public MetricKey key() {
        if (isBlank(metricName) || isBlank(entityId) || isBlank(period)) {
            throw new IllegalArgumentException("metricName, entityId and period are required");
        }
        return new MetricKey(metricName, entityId, period);
    }

    public List<Observation> toObservations() {
        if (observations == null) return List.of();
        return observations.stream()
            .filter(o -> o != null)
            .map(o -> new Observation(metricName, entityId, period,
                                      o.value() != null ? o.value() : Double.NaN,
                                      o.sourceId(), o.observedAt()))
            .toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
