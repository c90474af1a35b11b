package com.metricrecon.common.model;

/**
 * Ordered from least to most severe; {@link #NONE} only ever appears as the maximum of an empty set.
 */
public enum AnomalySeverity {
    NONE,
    MEDIUM,
    HIGH;

    public AnomalySeverity max(AnomalySeverity other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }
}
