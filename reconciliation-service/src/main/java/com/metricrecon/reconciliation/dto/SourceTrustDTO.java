package com.metricrecon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metricrecon.common.model.Source;
import com.metricrecon.common.model.SourceCategory;

public record SourceTrustDTO(
    @JsonProperty("sourceId")           String         sourceId,
    @JsonProperty("category")           SourceCategory category,
    @JsonProperty("categoryWeight")     double         categoryWeight,
    @JsonProperty("baseWeight")         double         baseWeight,
    @JsonProperty("historicalAccuracy") double         historicalAccuracy,
    @JsonProperty("effectiveWeight")    double         effectiveWeight
) {

    public static SourceTrustDTO of(Source source, double categoryWeight) {
        return new SourceTrustDTO(source.sourceId(), source.category(), categoryWeight,
                                  source.baseWeight(), source.historicalAccuracy(), source.effectiveWeight());
    }
}
