package com.metricrecon.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time snapshot of a registered data provider.
 *
 * <ul>
 *   <li>{@code baseWeight}         – static prior trust ([0.0, 1.0]).</li>
 *   <li>{@code historicalAccuracy} – rolling score moved only by review decisions ([0.0, 1.0]).</li>
 * </ul>
 */
public record Source(
    @JsonProperty("sourceId")           String         sourceId,
    @JsonProperty("category")           SourceCategory category,
    @JsonProperty("baseWeight")         double         baseWeight,
    @JsonProperty("historicalAccuracy") double         historicalAccuracy
) {

    /** Weight used when blending values: {@code baseWeight × historicalAccuracy}. */
    @JsonIgnore
    public double effectiveWeight() {
        return baseWeight * historicalAccuracy;
    }

    @JsonIgnore
    public boolean isRegulatory() {
        return category == SourceCategory.REGULATORY;
    }
}
