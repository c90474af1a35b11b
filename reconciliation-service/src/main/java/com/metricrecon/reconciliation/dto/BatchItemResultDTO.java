package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-unit result of a batch: either {@code resolution} or {@code error} is set.
 */
public record BatchItemResultDTO(
    @JsonProperty("metricName") String        metricName,
    @JsonProperty("entityId")   String        entityId,
    @JsonProperty("period")     String        period,
    @JsonProperty("resolution") ResolutionDTO resolution,
    @JsonProperty("error")      String        error
) {

    public static BatchItemResultDTO resolved(ResolveRequest unit, ResolutionDTO resolution) {
        return new BatchItemResultDTO(unit.metricName(), unit.entityId(), unit.period(), resolution, null);
    }

    public static BatchItemResultDTO failed(ResolveRequest unit, String error) {
        return new BatchItemResultDTO(unit.metricName(), unit.entityId(), unit.period(), null, error);
    }
}
